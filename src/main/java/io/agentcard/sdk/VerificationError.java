package io.agentcard.sdk;

/**
 * Reasons a single signature entry can fail verification.
 */
public enum VerificationError {
    MALFORMED_ENTRY,
    MALFORMED_HEADER,
    MISSING_ALGORITHM,
    DISALLOWED_ALGORITHM,
    UNSUPPORTED_ALGORITHM,
    INSECURE_KEY_URI,
    INVALID_KEY_URI,
    MISSING_KEY_URI,
    KEY_FETCH_TIMEOUT,
    KEY_FETCH_ERROR,
    CRYPTOGRAPHIC_MISMATCH,
    INTERNAL_ERROR
}
