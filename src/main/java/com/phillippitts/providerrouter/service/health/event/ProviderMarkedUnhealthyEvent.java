package com.phillippitts.providerrouter.service.health.event;

import java.time.Instant;

/**
 * Published once per healthy to unhealthy transition of a provider.
 */
public record ProviderMarkedUnhealthyEvent(
        String providerId,
        int consecutiveFailures,
        Instant at
) {
    public ProviderMarkedUnhealthyEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
