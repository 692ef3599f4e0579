package com.xksgroup.downloadtracker.service;

import com.xksgroup.downloadtracker.model.dto.ReconciliationResult;
import com.xksgroup.downloadtracker.service.helper.NonOverlappingTask;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the sync cycle and the retention sweep on two independent timers.
 * <p>
 * Timer threads only tick; each cycle runs on its own single worker so a slow
 * controller never makes ticks pile up. A tick that fires during a running
 * cycle is dropped.
 */
@Slf4j
@Component
public class SyncScheduler {

    private final ReconciliationService reconciliationService;
    private final MediaMatcherService mediaMatcherService;
    private final RetentionService retentionService;
    private final Clock clock;

    private final boolean enabled;
    private final long syncIntervalSeconds;
    private final long cleanupIntervalMinutes;

    private final ExecutorService syncWorker = Executors.newSingleThreadExecutor(named("sync-cycle"));
    private final ExecutorService retentionWorker = Executors.newSingleThreadExecutor(named("retention-cycle"));
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(named("tracker-timer"));

    private final NonOverlappingTask syncTask;
    private final NonOverlappingTask retentionTask;

    private final AtomicReference<Instant> lastSyncAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastCleanupAt = new AtomicReference<>();

    public SyncScheduler(ReconciliationService reconciliationService,
                         MediaMatcherService mediaMatcherService,
                         RetentionService retentionService,
                         Clock clock,
                         @Value("${tracker.scheduler.enabled:true}") boolean enabled,
                         @Value("${tracker.sync.interval-seconds:5}") long syncIntervalSeconds,
                         @Value("${tracker.cleanup.check-interval-minutes:60}") long cleanupIntervalMinutes) {
        this.reconciliationService = reconciliationService;
        this.mediaMatcherService = mediaMatcherService;
        this.retentionService = retentionService;
        this.clock = clock;
        this.enabled = enabled;
        this.syncIntervalSeconds = syncIntervalSeconds;
        this.cleanupIntervalMinutes = cleanupIntervalMinutes;
        this.syncTask = new NonOverlappingTask("sync", this::runSyncCycle, syncWorker);
        this.retentionTask = new NonOverlappingTask("cleanup", this::runRetentionCycle, retentionWorker);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Scheduler disabled, no sync or cleanup will run");
            return;
        }
        timer.scheduleAtFixedRate(syncTask, 0, syncIntervalSeconds, TimeUnit.SECONDS);
        timer.scheduleAtFixedRate(retentionTask, cleanupIntervalMinutes, cleanupIntervalMinutes, TimeUnit.MINUTES);
        log.info("Scheduler started: sync every {}s, cleanup every {}min", syncIntervalSeconds, cleanupIntervalMinutes);
    }

    /**
     * Abandons in-flight network calls. Store writes are per document, so nothing is left half-written.
     */
    @PreDestroy
    public void stop() {
        log.info("Shutting down scheduler");
        timer.shutdownNow();
        syncWorker.shutdownNow();
        retentionWorker.shutdownNow();
    }

    /**
     * One sync cycle: reconciliation first, then enrichment of whatever is still
     * missing metadata, so lookups always see this cycle's writes.
     */
    public void runSyncCycle() {
        ReconciliationResult result = reconciliationService.runCycle();
        if (result.isAborted()) {
            return;
        }
        lastSyncAt.set(clock.instant());
        mediaMatcherService.dispatchPending();
    }

    public void runRetentionCycle() {
        retentionService.purgeExpired();
        lastCleanupAt.set(clock.instant());
    }

    public NonOverlappingTask getSyncTask() {
        return syncTask;
    }

    public NonOverlappingTask getRetentionTask() {
        return retentionTask;
    }

    public Instant getLastSyncAt() {
        return lastSyncAt.get();
    }

    public Instant getLastCleanupAt() {
        return lastCleanupAt.get();
    }

    private static ThreadFactory named(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
