package com.phillippitts.providerrouter.service.metrics;

import com.phillippitts.providerrouter.service.health.event.RecoveryReason;
import com.phillippitts.providerrouter.service.routing.SelectionTier;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingMetricsTest {

    private SimpleMeterRegistry registry;
    private RoutingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RoutingMetrics(registry);
    }

    @Test
    void shouldCountSelectionsByTier() {
        metrics.recordSelection("narration", "p1", SelectionTier.PRIMARY);
        metrics.recordSelection("narration", "p1", SelectionTier.PRIMARY);
        metrics.recordSelection("narration", "p2", SelectionTier.FALLBACK);

        assertThat(registry.get("providerrouter.routing.selection")
                .tags("feature", "narration", "provider", "p1", "tier", "primary")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("providerrouter.routing.selection")
                .tag("tier", "fallback").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordOutcomeAndLatency() {
        metrics.recordOutcome("p1", true, 250.0);
        metrics.recordOutcome("p1", false, null);

        assertThat(registry.get("providerrouter.outcome").tag("result", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("providerrouter.outcome").tag("result", "failure").counter().count())
                .isEqualTo(1.0);
        Timer timer = registry.get("providerrouter.provider.latency").tag("provider", "p1").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }

    @Test
    void shouldCountTransitions() {
        metrics.recordExhausted("narration");
        metrics.recordUnhealthy("p1");
        metrics.recordRecovery("p1", RecoveryReason.SHORT_COOLDOWN);

        assertThat(registry.get("providerrouter.routing.exhausted").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("providerrouter.unhealthy").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("providerrouter.recovery").tag("reason", "short_cooldown").counter().count())
                .isEqualTo(1.0);
    }
}
