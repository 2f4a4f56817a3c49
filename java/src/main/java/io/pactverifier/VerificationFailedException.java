package io.pactverifier;

import java.util.Objects;

/**
 * Raised when a verification run completed but at least one interaction failed. The message stays generic; the
 * per-interaction detail is in {@link #getResult()} and in the log.
 */
public final class VerificationFailedException extends VerifierException {

    private static final long serialVersionUID = 1L;

    static final String MESSAGE = "Failed to verify the pact, please see the log for more details.";

    private final transient VerificationResult result;

    public VerificationFailedException(VerificationResult result) {
        super(ErrorCode.VERIFICATION_FAILED, MESSAGE);
        this.result = Objects.requireNonNull(result, "result");
    }

    /**
     * @return the complete run outcome, including passing verdicts.
     */
    public VerificationResult getResult() {
        return result;
    }
}
