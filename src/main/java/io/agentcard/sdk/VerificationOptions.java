package io.agentcard.sdk;

import java.time.Duration;

/**
 * Per-call verification options.
 *
 * @param timeout       bound on each key set fetch; {@code null}, zero or negative means {@link #DEFAULT_TIMEOUT}.
 * @param allowInsecure accept key set URIs that are not {@code https}. Never relaxes the ban on {@code alg=none}.
 */
public record VerificationOptions(Duration timeout, boolean allowInsecure) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(10_000);

    public VerificationOptions {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
    }

    public static VerificationOptions defaults() {
        return new VerificationOptions(DEFAULT_TIMEOUT, false);
    }

    public VerificationOptions withTimeout(Duration timeout) {
        return new VerificationOptions(timeout, allowInsecure);
    }

    public VerificationOptions withAllowInsecure(boolean allowInsecure) {
        return new VerificationOptions(timeout, allowInsecure);
    }
}
