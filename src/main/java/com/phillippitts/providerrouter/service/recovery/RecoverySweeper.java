package com.phillippitts.providerrouter.service.recovery;

import com.phillippitts.providerrouter.service.health.HealthMonitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic background task that applies the long recovery rule to every provider.
 *
 * <p>Lifecycle is explicit: {@link #start()} schedules ticks at a fixed rate, {@link #stop()}
 * stops scheduling further ticks and waits for an in-flight tick to finish. A stopped sweeper
 * can be started again.
 *
 * <p>Ticks never overlap: a tick that fires while the previous one is still running is skipped.
 */
public class RecoverySweeper {

    private static final Logger LOG = LogManager.getLogger(RecoverySweeper.class);

    private final HealthMonitor healthMonitor;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration interval;
    private final TaskDecorator taskDecorator;

    private final ReentrantLock sweepLock = new ReentrantLock();
    private final AtomicLong completedSweeps = new AtomicLong();
    private final AtomicLong skippedSweeps = new AtomicLong();

    private ScheduledFuture<?> scheduled;
    private volatile boolean stopped;

    public RecoverySweeper(HealthMonitor healthMonitor, TaskScheduler scheduler, Clock clock, Duration interval) {
        this(healthMonitor, scheduler, clock, interval, runnable -> runnable);
    }

    /**
     * @param taskDecorator wraps the scheduled sweep task, e.g. to carry logging context onto
     *                      the scheduler thread
     */
    public RecoverySweeper(HealthMonitor healthMonitor, TaskScheduler scheduler, Clock clock, Duration interval,
                           TaskDecorator taskDecorator) {
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.taskDecorator = Objects.requireNonNull(taskDecorator, "taskDecorator");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Schedules recurring sweeps. The first sweep runs one interval from now.
     * Calling start on a running sweeper has no effect.
     */
    public synchronized void start() {
        if (scheduled != null) {
            return;
        }
        stopped = false;
        Instant firstRun = scheduler.getClock().instant().plus(interval);
        scheduled = scheduler.scheduleAtFixedRate(taskDecorator.decorate(this::scheduledSweep), firstRun, interval);
        LOG.info("Recovery sweeper started: interval={}", interval);
    }

    /**
     * Stops scheduling sweeps and waits for a sweep in progress to complete.
     */
    public void stop() {
        ScheduledFuture<?> toCancel;
        synchronized (this) {
            toCancel = scheduled;
            scheduled = null;
            if (toCancel != null) {
                stopped = true;
            }
        }
        if (toCancel == null) {
            return;
        }
        toCancel.cancel(false);
        // Blocks until an in-flight sweep releases the lock
        sweepLock.lock();
        sweepLock.unlock();
        LOG.info("Recovery sweeper stopped after {} sweeps ({} skipped)", completedSweeps.get(), skippedSweeps.get());
    }

    public synchronized boolean isRunning() {
        return scheduled != null;
    }

    /**
     * Runs one sweep on the calling thread unless another sweep is in progress.
     *
     * @return providers recovered by this sweep; 0 when skipped or failed
     */
    public int sweepNow() {
        return sweep(false);
    }

    private void scheduledSweep() {
        sweep(true);
    }

    private int sweep(boolean scheduledTick) {
        if (!sweepLock.tryLock()) {
            skippedSweeps.incrementAndGet();
            LOG.debug("Recovery sweep already in progress; skipping tick");
            return 0;
        }
        ThreadContext.put("task", "recovery-sweep");
        try {
            // A tick that started before stop() must not sweep after it returns
            if (scheduledTick && stopped) {
                LOG.debug("Recovery sweeper stopped; dropping late tick");
                return 0;
            }
            int recovered = healthMonitor.sweepLongRecovery(clock.instant());
            completedSweeps.incrementAndGet();
            if (recovered > 0) {
                LOG.info("Recovery sweep restored {} provider(s)", recovered);
            } else {
                LOG.debug("Recovery sweep found nothing to restore");
            }
            return recovered;
        } catch (RuntimeException e) {
            // An escaping exception would cancel the fixed-rate schedule
            LOG.error("Recovery sweep failed", e);
            return 0;
        } finally {
            ThreadContext.remove("task");
            sweepLock.unlock();
        }
    }

    public long getCompletedSweeps() {
        return completedSweeps.get();
    }

    public long getSkippedSweeps() {
        return skippedSweeps.get();
    }

    public Duration getInterval() {
        return interval;
    }
}
