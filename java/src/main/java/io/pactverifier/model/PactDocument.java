package io.pactverifier.model;

import io.pactverifier.ErrorCode;
import io.pactverifier.VerifierException;

import java.util.List;
import java.util.Locale;

/**
 * A parsed pact: the consumer, the provider and the interactions between them, in document order.
 */
public record PactDocument(
    String consumer,
    String provider,
    List<Interaction> interactions,
    String specificationVersion
) {
    public PactDocument {
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
    }

    /**
     * Returns a view over a subset of this document's interactions. The receiver is left untouched.
     */
    public PactDocument withInteractions(List<Interaction> subset) {
        return new PactDocument(consumer, provider, subset, specificationVersion);
    }

    /**
     * Checks the document is usable for verification and reports the first violation found.
     *
     * @throws VerifierException with {@link ErrorCode#INVALID_DOCUMENT}.
     */
    public void validate() throws VerifierException {
        if (isBlank(consumer)) {
            throw invalid("consumer name is required");
        }
        if (isBlank(provider)) {
            throw invalid("provider name is required");
        }
        for (int i = 0; i < interactions.size(); i++) {
            Interaction interaction = interactions.get(i);
            if (interaction == null) {
                throw invalid(at(i, "interaction is null"));
            }
            if (isBlank(interaction.description())) {
                throw invalid(at(i, "description is required"));
            }
            ExpectedRequest request = interaction.request();
            if (request == null) {
                throw invalid(at(i, "request is required"));
            }
            if (isBlank(request.method())) {
                throw invalid(at(i, "request method is required"));
            }
            if (request.path() == null || !request.path().startsWith("/")) {
                throw invalid(at(i, "request path must start with '/'"));
            }
            ExpectedResponse response = interaction.response();
            if (response == null) {
                throw invalid(at(i, "response is required"));
            }
            if (response.status() < 100 || response.status() > 599) {
                throw invalid(at(i, "response status " + response.status() + " is not a valid HTTP status"));
            }
        }
    }

    private static String at(int index, String message) {
        return String.format(Locale.ROOT, "interaction[%d]: %s", index, message);
    }

    private static VerifierException invalid(String message) {
        return new VerifierException(ErrorCode.INVALID_DOCUMENT, "invalid pact document: " + message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
