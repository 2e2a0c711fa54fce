package in.lockvault.application.service;

import in.lockvault.domain.role.ExpiryProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process trigger for the expiry probe/sweep pair.
 * Off by default; deployments normally rely on the external trigger calling the HTTP endpoints.
 */
public final class ExpirySweepJob {
    private static final Logger log = LoggerFactory.getLogger(ExpirySweepJob.class);

    private final ExpiryScheduler expiryScheduler;
    private final Duration pollInterval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private volatile long totalRuns = 0;
    private volatile long totalExpired = 0;
    private volatile Instant lastRunTime;

    public ExpirySweepJob(ExpiryScheduler expiryScheduler, Duration pollInterval, Clock clock) {
        this.expiryScheduler = expiryScheduler;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                r -> new Thread(r, "expiry-sweep"));
    }

    public void start() {
        long period = pollInterval.toSeconds();
        scheduler.scheduleAtFixedRate(this::runSafely, period, period, TimeUnit.SECONDS);
        log.info("Expiry sweep job started: interval={}s", period);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One probe, and a sweep if the probe found work.
     *
     * @return roles deactivated by this run
     */
    public int runOnce() {
        ExpiryProbeResult probe = expiryScheduler.probe();
        int expired = probe.workNeeded() ? expiryScheduler.sweep(probe.candidates()) : 0;
        totalRuns++;
        totalExpired += expired;
        lastRunTime = clock.instant();
        return expired;
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Expiry sweep run failed", e);
        }
    }

    public long getTotalRuns() {
        return totalRuns;
    }

    public long getTotalExpired() {
        return totalExpired;
    }

    public Instant getLastRunTime() {
        return lastRunTime;
    }
}
