package com.phillippitts.providerrouter.service.health.event;

import java.time.Instant;

/**
 * Published when an unhealthy provider becomes healthy again.
 */
public record ProviderRecoveredEvent(
        String providerId,
        RecoveryReason reason,
        Instant at
) {
    public ProviderRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}
