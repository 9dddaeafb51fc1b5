package io.agentcard.sdk;

import java.util.Objects;

/**
 * Raised by the individual verification stages. Each instance carries the {@link VerificationError} that
 * ends up on the corresponding {@link SignatureResult}; the exception never escapes a whole-card verification.
 */
public class SignatureVerificationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final VerificationError error;

    public SignatureVerificationException(VerificationError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public SignatureVerificationException(VerificationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * @return the failure category, never {@code null}.
     */
    public VerificationError getError() {
        return error;
    }
}
