package io.pactverifier.source;

import io.pactverifier.ErrorCode;
import io.pactverifier.PactUriConfig;
import io.pactverifier.VerifierConfig;
import io.pactverifier.VerifierException;
import io.pactverifier.model.PactDocument;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Chooses the {@link PactSource} variant for a pact URI and fetches validated documents through it.
 */
public final class PactSources {

    private PactSources() {
    }

    /**
     * @return {@code true} when the URI has an {@code http} or {@code https} scheme.
     */
    public static boolean isWebUri(String uri) {
        if (uri == null || uri.isBlank()) {
            return false;
        }
        try {
            String scheme = URI.create(uri.trim()).getScheme();
            if (scheme == null) {
                return false;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            return normalized.equals("http") || normalized.equals("https");
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    public static PactSource forUri(String uri, PactUriConfig credentials, VerifierConfig config) throws VerifierException {
        if (uri == null || uri.isBlank()) {
            throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE,
                "Pact uri cannot be empty, please provide a valid value using PactUri function.");
        }
        VerifierConfig resolved = config == null ? VerifierConfig.defaults() : config.withDefaults();
        String trimmed = uri.trim();
        if (isWebUri(trimmed)) {
            return new UrlPactSource(resolved.getHttpClient(), URI.create(trimmed), credentials, resolved.getHttpTimeout());
        }
        try {
            if (trimmed.regionMatches(true, 0, "file:", 0, 5)) {
                return new FilePactSource(Path.of(URI.create(trimmed)));
            }
            return new FilePactSource(Path.of(trimmed));
        } catch (IllegalArgumentException ex) {
            throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE, "invalid pact path " + trimmed + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Resolves, reads and validates a pact document in one step.
     */
    public static PactDocument fetch(String uri, PactUriConfig credentials, VerifierConfig config) throws VerifierException {
        PactDocument document = forUri(uri, credentials, config).read();
        document.validate();
        return document;
    }
}
