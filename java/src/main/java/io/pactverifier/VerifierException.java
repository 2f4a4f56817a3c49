package io.pactverifier;

import java.util.Objects;

/**
 * Base exception thrown by the pact verifier. The {@link ErrorCode} tells callers which stage failed.
 */
public class VerifierException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    public VerifierException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public VerifierException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }
}
