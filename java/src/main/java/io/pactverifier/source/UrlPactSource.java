package io.pactverifier.source;

import io.pactverifier.ErrorCode;
import io.pactverifier.PactUriConfig;
import io.pactverifier.VerifierException;
import io.pactverifier.internal.HttpUtil;
import io.pactverifier.model.PactDocument;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fetches a pact document over HTTP, typically from a pact broker, with optional basic authentication.
 */
public final class UrlPactSource implements PactSource {

    private static final Logger LOGGER = Logger.getLogger(UrlPactSource.class.getName());

    private final HttpClient httpClient;
    private final URI uri;
    private final PactUriConfig credentials;
    private final Duration timeout;

    public UrlPactSource(HttpClient httpClient, URI uri, PactUriConfig credentials, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.credentials = credentials == null ? PactUriConfig.NONE : credentials;
        this.timeout = timeout;
    }

    @Override
    public PactDocument read() throws VerifierException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/hal+json, application/json");
        if (credentials.hasUsername()) {
            headers.put("Authorization", HttpUtil.basicAuth(credentials.username(), credentials.password()));
        }

        LOGGER.fine(() -> String.format(Locale.ROOT, "[pact-verifier] fetching pact from %s (auth: %s)",
            location(), credentials.hasUsername() ? "basic" : "none"));

        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.send(httpClient, "GET", uri, headers, null, timeout);
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE, "fetch pact " + location() + " interrupted", ex);
            }
            String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE, "fetch pact " + location() + ": " + reason, ex);
        }

        if (response.statusCode() >= 400) {
            throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE,
                "fetch pact " + location() + ": server responded with status " + response.statusCode());
        }
        return PactParser.parse(response.body(), location());
    }

    @Override
    public String location() {
        if (uri.getRawUserInfo() == null) {
            return uri.toString();
        }
        try {
            return new URI(uri.getScheme(), null, uri.getHost(), uri.getPort(), uri.getPath(), uri.getQuery(), null).toString();
        } catch (URISyntaxException ex) {
            return uri.getScheme() + "://" + uri.getHost();
        }
    }
}
