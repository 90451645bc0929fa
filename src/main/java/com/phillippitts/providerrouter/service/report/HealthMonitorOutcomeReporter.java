package com.phillippitts.providerrouter.service.report;

import com.phillippitts.providerrouter.exception.ConfigException;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.health.HealthMonitor;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;

import java.util.Objects;

/**
 * Pass-through reporter: validates the provider id, counts the outcome and applies it to the
 * {@link HealthMonitor}.
 */
public class HealthMonitorOutcomeReporter implements OutcomeReporter {

    private final ProviderCatalog catalog;
    private final HealthMonitor healthMonitor;
    private final RoutingMetrics metrics;

    public HealthMonitorOutcomeReporter(ProviderCatalog catalog, HealthMonitor healthMonitor,
                                        RoutingMetrics metrics) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void report(String providerId, boolean success, Double latencyMs) {
        if (!catalog.contains(providerId)) {
            throw ConfigException.unknownProvider(providerId);
        }
        metrics.recordOutcome(providerId, success, latencyMs);
        healthMonitor.recordOutcome(providerId, success, latencyMs);
    }
}
