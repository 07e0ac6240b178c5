package com.bitcoinsprint.gateway.ratelimit;

/**
 * Outcome of {@link TierRateLimiter#admit}.
 */
public sealed interface Admission permits Admission.Admitted, Admission.Rejected {

    boolean admitted();

    /**
     * The caller holds one concurrency slot until {@link Permit#release()} is called.
     *
     * @param minuteLimit     per-minute limit of the caller's tier
     * @param minuteRemaining requests left in the current minute window after this one
     */
    record Admitted(Permit permit, int minuteLimit, int minuteRemaining) implements Admission {
        @Override
        public boolean admitted() {
            return true;
        }
    }

    /**
     * @param retryAfterSeconds whole seconds until the binding window resets, at least 1
     */
    record Rejected(RejectReason reason, long retryAfterSeconds) implements Admission {
        @Override
        public boolean admitted() {
            return false;
        }
    }
}
