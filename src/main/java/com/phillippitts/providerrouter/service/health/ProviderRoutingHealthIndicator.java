package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.domain.Provider;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the provider pool.
 *
 * <p>Reports availability of active providers:
 * <ul>
 *   <li>UP: every active provider healthy</li>
 *   <li>DEGRADED: at least one active provider healthy</li>
 *   <li>DOWN: no active provider healthy</li>
 * </ul>
 *
 * <p>Health is read without side effects; querying the endpoint never heals a provider.
 * Exposed via /actuator/health.
 */
@Component
public class ProviderRoutingHealthIndicator implements HealthIndicator {

    private final ProviderCatalog catalog;
    private final HealthMonitor healthMonitor;

    public ProviderRoutingHealthIndicator(ProviderCatalog catalog, HealthMonitor healthMonitor) {
        this.catalog = catalog;
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Health health() {
        Map<String, String> providers = new TreeMap<>();
        int ready = 0;
        int unhealthy = 0;
        for (Provider p : catalog.all()) {
            if (!catalog.isActive(p.id())) {
                providers.put(p.id(), "inactive");
            } else if (healthMonitor.peekHealthy(p.id())) {
                providers.put(p.id(), "ready");
                ready++;
            } else {
                providers.put(p.id(), "unhealthy");
                unhealthy++;
            }
        }

        Health.Builder builder = new Health.Builder();
        if (ready > 0 && unhealthy == 0) {
            builder.up().withDetail("status", "All active providers operational");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial provider availability");
        } else {
            builder.down().withDetail("status", "No providers available");
        }
        return builder
                .withDetail("healthy", ready)
                .withDetail("unhealthy", unhealthy)
                .withDetail("providers", providers)
                .build();
    }
}
