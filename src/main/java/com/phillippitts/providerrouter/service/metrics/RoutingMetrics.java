package com.phillippitts.providerrouter.service.metrics;

import com.phillippitts.providerrouter.service.health.event.RecoveryReason;
import com.phillippitts.providerrouter.service.routing.SelectionTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for provider routing.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Selections per feature, provider and tier (primary, fallback, emergency)</li>
 *   <li>Routing exhaustion per feature</li>
 *   <li>Reported outcomes and latency per provider</li>
 *   <li>Unhealthy transitions and recoveries per provider</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RoutingMetrics {

    private static final String METRIC_PREFIX = "providerrouter";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one routing decision.
     *
     * @param feature feature that was routed
     * @param providerId provider that was returned
     * @param tier which part of the chain served the decision
     */
    public void recordSelection(String feature, String providerId, SelectionTier tier) {
        Counter.builder(METRIC_PREFIX + ".routing.selection")
                .description("Number of routing decisions")
                .tag("feature", feature)
                .tag("provider", providerId)
                .tag("tier", tier.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts one decision that found no eligible provider.
     */
    public void recordExhausted(String feature) {
        Counter.builder(METRIC_PREFIX + ".routing.exhausted")
                .description("Number of routing decisions with no eligible provider")
                .tag("feature", feature)
                .register(registry)
                .increment();
    }

    /**
     * Counts a reported call outcome and records its latency when known.
     *
     * @param providerId provider that was called
     * @param success whether the call succeeded
     * @param latencyMs observed latency in milliseconds, or null
     */
    public void recordOutcome(String providerId, boolean success, Double latencyMs) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of reported provider call outcomes")
                .tag("provider", providerId)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
        if (latencyMs != null && latencyMs >= 0.0) {
            Timer.builder(METRIC_PREFIX + ".provider.latency")
                    .description("Latency of provider calls as reported by callers")
                    .tag("provider", providerId)
                    .register(registry)
                    .record((long) (latencyMs * 1000.0), TimeUnit.MICROSECONDS);
        }
    }

    public void recordUnhealthy(String providerId) {
        Counter.builder(METRIC_PREFIX + ".unhealthy")
                .description("Number of healthy to unhealthy transitions")
                .tag("provider", providerId)
                .register(registry)
                .increment();
    }

    public void recordRecovery(String providerId, RecoveryReason reason) {
        Counter.builder(METRIC_PREFIX + ".recovery")
                .description("Number of provider recoveries by reason")
                .tag("provider", providerId)
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
