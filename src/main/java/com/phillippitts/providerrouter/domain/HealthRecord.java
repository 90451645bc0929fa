package com.phillippitts.providerrouter.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable per-provider trust state.
 *
 * <p>Every transition returns a new record; the health monitor swaps records atomically per
 * provider id so readers never observe a partially updated value.
 *
 * @param providerId provider this record describes
 * @param healthy whether the provider is currently trusted
 * @param consecutiveFailures failures since the last success or recovery
 * @param lastChecked time of the last outcome or recovery
 * @param averageLatencyMs rolling latency average in milliseconds
 */
public record HealthRecord(
        String providerId,
        boolean healthy,
        int consecutiveFailures,
        Instant lastChecked,
        double averageLatencyMs
) {

    /** Seed latency for records that have not seen a latency sample yet. */
    public static final double INITIAL_AVERAGE_LATENCY_MS = 1000.0;

    public HealthRecord {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(lastChecked, "lastChecked");
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 0");
        }
    }

    public static HealthRecord initial(String providerId, Instant now) {
        return new HealthRecord(providerId, true, 0, now, INITIAL_AVERAGE_LATENCY_MS);
    }

    /**
     * Success always restores trust and resets the failure counter.
     *
     * @param now outcome time
     * @param latencyMs observed latency, or null when not measured
     */
    public HealthRecord afterSuccess(Instant now, Double latencyMs) {
        double average = averageLatencyMs;
        if (latencyMs != null && latencyMs >= 0.0) {
            average = (averageLatencyMs + latencyMs) / 2.0;
        }
        return new HealthRecord(providerId, true, 0, now, average);
    }

    /**
     * Counts one more failure; trust is lost once the count reaches {@code failureThreshold}.
     */
    public HealthRecord afterFailure(Instant now, int failureThreshold) {
        int failures = consecutiveFailures + 1;
        boolean stillHealthy = healthy && failures < failureThreshold;
        return new HealthRecord(providerId, stillHealthy, failures, now, averageLatencyMs);
    }

    /**
     * Forced recovery. {@code lastChecked} is left untouched so the record keeps its history.
     */
    public HealthRecord recovered() {
        return new HealthRecord(providerId, true, 0, lastChecked, averageLatencyMs);
    }

    /**
     * Returns true when the record is unhealthy and at least {@code cooldown} has elapsed since
     * {@code lastChecked}.
     */
    public boolean cooledDown(Instant now, Duration cooldown) {
        return !healthy && Duration.between(lastChecked, now).compareTo(cooldown) >= 0;
    }
}
