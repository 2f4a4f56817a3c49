package io.pactverifier;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Immutable settings shared by every verification run of a {@link PactVerifier}.
 */
public final class VerifierConfig {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_LOGGER_NAME = PactVerifier.class.getName();

    private final Logger logger;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private VerifierConfig(Builder builder) {
        this.logger = builder.logger;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every default applied.
     */
    public static VerifierConfig defaults() {
        return builder().build();
    }

    public VerifierConfig withDefaults() {
        Logger resolvedLogger = Optional.ofNullable(logger).orElseGet(() -> Logger.getLogger(DEFAULT_LOGGER_NAME));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .logger(resolvedLogger)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    public Logger getLogger() {
        return logger;
    }

    /**
     * @return client used to fetch remote pact documents. Provider calls use the client passed to
     *         {@link Verifier#serviceProvider}.
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * @return per-request timeout applied to pact fetches and provider calls.
     */
    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private Logger logger;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public VerifierConfig build() {
            return new VerifierConfig(this).withDefaults();
        }

        private VerifierConfig buildInternal() {
            return new VerifierConfig(this);
        }
    }
}
