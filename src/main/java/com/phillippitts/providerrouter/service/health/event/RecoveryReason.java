package com.phillippitts.providerrouter.service.health.event;

/**
 * Why an unhealthy provider was trusted again.
 */
public enum RecoveryReason {
    /** A successful call was reported. */
    SUCCESS,
    /** Lazy recovery when the provider was queried after the short cooldown. */
    SHORT_COOLDOWN,
    /** Eager recovery by the background sweep after the long cooldown. */
    LONG_SWEEP
}
