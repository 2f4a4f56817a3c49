package io.pactverifier.source;

import io.pactverifier.VerifierException;
import io.pactverifier.model.PactDocument;

/**
 * Reads a pact document from wherever it is stored.
 */
public interface PactSource {

    /**
     * Reads and parses the document. Implementations perform a single attempt.
     *
     * @throws VerifierException {@code SOURCE_UNAVAILABLE} when the bytes cannot be obtained,
     *                           {@code MALFORMED_DOCUMENT} or {@code INVALID_DOCUMENT} when they cannot be parsed.
     */
    PactDocument read() throws VerifierException;

    /**
     * @return a printable location, free of credentials.
     */
    String location();
}
