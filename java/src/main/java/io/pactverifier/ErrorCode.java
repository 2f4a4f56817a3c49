package io.pactverifier;

/**
 * Classifies every failure the verifier can report.
 */
public enum ErrorCode {

    /** Consumer name was never set. */
    EMPTY_CONSUMER,
    /** Provider name was never set. */
    EMPTY_PROVIDER,
    /** No HTTP client or base URL is bound for the provider under test. */
    PROVIDER_NOT_CONFIGURED,
    /** The pact document could not be read. */
    SOURCE_UNAVAILABLE,
    /** The pact document could not be parsed. */
    MALFORMED_DOCUMENT,
    /** The pact document parsed but is structurally invalid. */
    INVALID_DOCUMENT,
    /** Description and/or provider state filters selected nothing. */
    NO_MATCHING_INTERACTIONS,
    SETUP_FAILED,
    TEARDOWN_FAILED,
    TRANSPORT_ERROR,
    MISMATCH_FOUND,
    /** At least one interaction failed. */
    VERIFICATION_FAILED;

    /**
     * @return {@code true} for codes recorded against a single interaction rather than aborting the run.
     */
    public boolean isInteractionLevel() {
        return this == SETUP_FAILED || this == TEARDOWN_FAILED || this == TRANSPORT_ERROR || this == MISMATCH_FOUND;
    }
}
