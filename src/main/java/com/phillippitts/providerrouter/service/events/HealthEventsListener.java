package com.phillippitts.providerrouter.service.events;

import com.phillippitts.providerrouter.service.health.event.ProviderMarkedUnhealthyEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderRecoveredEvent;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns provider health transitions into metrics and operator-facing warnings.
 * Warnings for a flapping provider are throttled to avoid log spam.
 */
@Component
class HealthEventsListener {
    private static final Logger LOG = LogManager.getLogger(HealthEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final RoutingMetrics metrics;
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    HealthEventsListener(RoutingMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onUnhealthy(ProviderMarkedUnhealthyEvent e) {
        metrics.recordUnhealthy(e.providerId());
        if (shouldLog("unhealthy-" + e.providerId(), e.at())) {
            LOG.warn("Provider {} is out of rotation after {} consecutive failures; "
                    + "traffic moves to fallbacks until it recovers", e.providerId(), e.consecutiveFailures());
        }
    }

    @EventListener
    void onRecovered(ProviderRecoveredEvent e) {
        metrics.recordRecovery(e.providerId(), e.reason());
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
