package com.wgbot.application.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs {@link SubscriptionReconciler#sweep} at a fixed rate, first tick immediately.
 *
 * Sweeps never overlap: a tick that fires while the previous sweep is still running is skipped.
 * {@link #stop()} halts further ticks; a sweep already in flight is allowed to finish.
 * A manual {@link #tick()} still works after stop and then runs on the caller's thread.
 */
public class SweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final SubscriptionReconciler reconciler;
    private final Duration interval;
    private final Clock clock;

    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicLong skipped = new AtomicLong();
    private volatile Consumer<SweepReport> listener = report -> {};

    private volatile boolean running = false;
    private volatile ScheduledExecutorService ticker;
    private volatile ExecutorService worker;
    private volatile ScheduledFuture<?> future;

    public SweepScheduler(SubscriptionReconciler reconciler, Duration interval, Clock clock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        this.reconciler = reconciler;
        this.interval = interval;
        this.clock = clock;
    }

    /**
     * Receives every completed report, e.g. for metrics.
     */
    public void onReport(Consumer<SweepReport> listener) {
        this.listener = listener == null ? report -> {} : listener;
    }

    public synchronized void start() {
        if (future != null && !future.isCancelled()) return;
        ticker = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "wgbot-sweep-ticker"));
        worker = Executors.newSingleThreadExecutor(r -> daemon(r, "wgbot-sweep"));
        running = true;
        future = ticker.scheduleAtFixedRate(this::scheduledTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Subscription sweeps scheduled every {}", interval);
    }

    public synchronized void stop() {
        running = false;
        if (future != null) future.cancel(false);
        if (ticker != null) ticker.shutdownNow();
        if (worker != null) worker.shutdown();
        future = null;
        log.info("Subscription sweeps stopped");
    }

    public boolean isRunning() {
        return running && future != null && !future.isCancelled();
    }

    public boolean isBusy() {
        return busy.get();
    }

    public long skippedTicks() {
        return skipped.get();
    }

    /**
     * Dispatches one sweep now unless one is already in flight (manual trigger).
     *
     * @return false if the tick was skipped
     */
    public boolean tick() {
        return dispatch(false);
    }

    /**
     * Timer entry point: does nothing once the scheduler is stopped.
     */
    boolean scheduledTick() {
        if (!running) return false;
        return dispatch(true);
    }

    private boolean dispatch(boolean scheduled) {
        if (!busy.compareAndSet(false, true)) {
            skipped.incrementAndGet();
            log.warn("Previous sweep still running, skipping this tick");
            return false;
        }
        try {
            ExecutorService target = worker;
            if (target == null || target.isShutdown()) {
                if (scheduled) {
                    busy.set(false);
                    return false;
                }
                runSweep(false);
            } else {
                target.execute(() -> runSweep(scheduled));
            }
            return true;
        } catch (RuntimeException e) {
            busy.set(false);
            log.warn("Could not dispatch sweep: {}", e.getMessage());
            return false;
        }
    }

    private void runSweep(boolean scheduled) {
        try {
            if (scheduled && !running) {
                log.info("Scheduler stopped, dropping queued sweep");
                return;
            }
            SweepReport report = reconciler.sweep(clock.instant());
            listener.accept(report);
        } catch (RuntimeException e) {
            log.error("Sweep failed", e);
        } finally {
            busy.set(false);
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }
}
