package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.domain.HealthRecord;
import com.phillippitts.providerrouter.service.health.event.ProviderMarkedUnhealthyEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderRecoveredEvent;
import com.phillippitts.providerrouter.service.health.event.RecoveryReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks per-provider trust from reported call outcomes and heals providers over time.
 *
 * <p>State model, per provider id:
 * <ul>
 *   <li>No record: healthy (optimistic default).</li>
 *   <li>Each failure increments a consecutive-failure counter; reaching the failure threshold
 *       (default 3) marks the provider unhealthy.</li>
 *   <li>Any success marks the provider healthy and resets the counter.</li>
 * </ul>
 *
 * <p>Two recovery paths coexist:
 * <ul>
 *   <li><b>Short</b> (default 10 minutes) - evaluated lazily by {@link #isHealthy(String)}, so a
 *       provider that is still being routed to heals on read.</li>
 *   <li><b>Long</b> (default 30 minutes) - evaluated eagerly by {@link #sweepLongRecovery(Instant)}
 *       across all records, so providers that went cold heal too.</li>
 * </ul>
 *
 * <p>Thread safety: records are immutable and replaced through
 * {@link ConcurrentMap#compute}, which makes every read-modify-write atomic per provider id.
 * Concurrent outcomes for the same provider are applied one after another in arrival order;
 * none are lost. Events are published after the swap, outside the per-key critical section.
 */
public class HealthMonitor {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_SHORT_RECOVERY = Duration.ofMinutes(10);
    public static final Duration DEFAULT_LONG_RECOVERY = Duration.ofMinutes(30);

    private final ConcurrentMap<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int failureThreshold;
    private final Duration shortRecovery;
    private final Duration longRecovery;
    private final ApplicationEventPublisher publisher;

    public HealthMonitor(Clock clock, ApplicationEventPublisher publisher) {
        this(clock, DEFAULT_FAILURE_THRESHOLD, DEFAULT_SHORT_RECOVERY, DEFAULT_LONG_RECOVERY, publisher);
    }

    public HealthMonitor(Clock clock,
                         int failureThreshold,
                         Duration shortRecovery,
                         Duration longRecovery,
                         ApplicationEventPublisher publisher) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.shortRecovery = Objects.requireNonNull(shortRecovery, "shortRecovery");
        this.longRecovery = Objects.requireNonNull(longRecovery, "longRecovery");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        this.failureThreshold = failureThreshold;
        LOG.info("Health monitor initialized: failureThreshold={}, shortRecovery={}, longRecovery={}",
                failureThreshold, shortRecovery, longRecovery);
    }

    /**
     * Applies one call outcome to the provider's record, creating the record if needed.
     *
     * @param providerId provider that was called
     * @param success whether the call succeeded
     * @param latencyMs observed latency, or null; only successful samples feed the average
     */
    public void recordOutcome(String providerId, boolean success, Double latencyMs) {
        Objects.requireNonNull(providerId, "providerId");
        Instant now = clock.instant();
        AtomicReference<HealthRecord> before = new AtomicReference<>();
        HealthRecord after = records.compute(providerId, (id, existing) -> {
            HealthRecord current = existing != null ? existing : HealthRecord.initial(id, now);
            before.set(current);
            return success
                    ? current.afterSuccess(now, latencyMs)
                    : current.afterFailure(now, failureThreshold);
        });

        boolean wasHealthy = before.get().healthy();
        if (wasHealthy && !after.healthy()) {
            LOG.warn("Provider {} marked unhealthy after {} consecutive failures",
                    providerId, after.consecutiveFailures());
            publisher.publishEvent(new ProviderMarkedUnhealthyEvent(providerId, after.consecutiveFailures(), now));
        } else if (!wasHealthy && after.healthy()) {
            LOG.info("Provider {} recovered after a successful call", providerId);
            publisher.publishEvent(new ProviderRecoveredEvent(providerId, RecoveryReason.SUCCESS, now));
        } else if (!success) {
            LOG.debug("Provider {} failure recorded: consecutiveFailures={}", providerId, after.consecutiveFailures());
        }
    }

    /**
     * Returns whether the provider may be routed to right now.
     *
     * <p>An unhealthy provider whose last check is at least the short cooldown ago is healed by
     * this call. A provider seen for the first time gets a fresh healthy record.
     *
     * @param providerId provider to check
     * @return true if healthy (or healed by this call)
     */
    public boolean isHealthy(String providerId) {
        Objects.requireNonNull(providerId, "providerId");
        HealthRecord current = records.get(providerId);
        if (current != null && current.healthy()) {
            return true;
        }

        Instant now = clock.instant();
        AtomicBoolean recoveredHere = new AtomicBoolean(false);
        HealthRecord result = records.compute(providerId, (id, existing) -> {
            if (existing == null) {
                return HealthRecord.initial(id, now);
            }
            if (existing.cooledDown(now, shortRecovery)) {
                recoveredHere.set(true);
                return existing.recovered();
            }
            return existing;
        });

        if (recoveredHere.get()) {
            LOG.info("Auto-recovering provider {} after cooldown of {}", providerId, shortRecovery);
            publisher.publishEvent(new ProviderRecoveredEvent(providerId, RecoveryReason.SHORT_COOLDOWN, now));
        }
        return result.healthy();
    }

    /**
     * Read-only health evaluation used by status reporting. Applies the short recovery rule
     * without mutating the record.
     */
    public boolean peekHealthy(String providerId) {
        HealthRecord current = records.get(providerId);
        return current == null || current.healthy() || current.cooledDown(clock.instant(), shortRecovery);
    }

    /**
     * Forces every provider unhealthy for at least the long cooldown back to healthy.
     *
     * <p>The pass is not atomic as a whole; each record is swapped atomically on its own.
     *
     * @param now reference time of the sweep
     * @return number of providers recovered by this pass
     */
    public int sweepLongRecovery(Instant now) {
        Objects.requireNonNull(now, "now");
        List<String> recovered = new ArrayList<>();
        for (String providerId : records.keySet()) {
            AtomicBoolean recoveredHere = new AtomicBoolean(false);
            records.computeIfPresent(providerId, (id, existing) -> {
                if (existing.cooledDown(now, longRecovery)) {
                    recoveredHere.set(true);
                    return existing.recovered();
                }
                return existing;
            });
            if (recoveredHere.get()) {
                recovered.add(providerId);
            }
        }
        for (String providerId : recovered) {
            LOG.info("Auto-recovering provider {} after extended downtime", providerId);
            publisher.publishEvent(new ProviderRecoveredEvent(providerId, RecoveryReason.LONG_SWEEP, now));
        }
        return recovered.size();
    }

    public Optional<HealthRecord> snapshot(String providerId) {
        return Optional.ofNullable(providerId == null ? null : records.get(providerId));
    }

    /** All records, sorted by provider id. */
    public List<HealthRecord> snapshots() {
        return records.values().stream()
                .sorted(Comparator.comparing(HealthRecord::providerId))
                .toList();
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getShortRecovery() {
        return shortRecovery;
    }

    public Duration getLongRecovery() {
        return longRecovery;
    }
}
