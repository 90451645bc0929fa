package com.phillippitts.providerrouter.service.events;

import com.phillippitts.providerrouter.service.health.event.ProviderMarkedUnhealthyEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderRecoveredEvent;
import com.phillippitts.providerrouter.service.health.event.RecoveryReason;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class HealthEventsListenerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void throttlesWarningsPerKey() {
        HealthEventsListener listener = new HealthEventsListener(mock(RoutingMetrics.class));

        assertThat(listener.shouldLog("unhealthy-p1", T0)).isTrue();
        assertThat(listener.shouldLog("unhealthy-p1", T0.plusSeconds(30))).isFalse();
        assertThat(listener.shouldLog("unhealthy-p2", T0.plusSeconds(30))).isTrue();
        assertThat(listener.shouldLog("unhealthy-p1", T0.plusSeconds(61))).isTrue();
    }

    @Test
    void everyTransitionIsCountedEvenWhenLogThrottled() {
        RoutingMetrics metrics = mock(RoutingMetrics.class);
        HealthEventsListener listener = new HealthEventsListener(metrics);

        listener.onUnhealthy(new ProviderMarkedUnhealthyEvent("p1", 3, T0));
        listener.onUnhealthy(new ProviderMarkedUnhealthyEvent("p1", 3, T0.plusSeconds(1)));
        listener.onRecovered(new ProviderRecoveredEvent("p1", RecoveryReason.LONG_SWEEP, T0));

        verify(metrics, times(2)).recordUnhealthy("p1");
        verify(metrics).recordRecovery("p1", RecoveryReason.LONG_SWEEP);
    }
}
