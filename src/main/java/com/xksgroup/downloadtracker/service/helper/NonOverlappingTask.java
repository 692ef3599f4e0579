package com.xksgroup.downloadtracker.service.helper;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timer-driven task that hands its body to a worker and skips any tick that fires
 * while the previous run is still in progress. Skipped ticks are dropped, never queued.
 */
@Slf4j
public class NonOverlappingTask implements Runnable {

    private final String name;
    private final Runnable body;
    private final Executor worker;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong startedRuns = new AtomicLong();
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();

    public NonOverlappingTask(String name, Runnable body, Executor worker) {
        this.name = name;
        this.body = body;
        this.worker = worker;
    }

    /**
     * One timer tick.
     */
    @Override
    public void run() {
        tick();
    }

    /**
     * @return true if a run was started, false if the tick was skipped
     */
    public boolean tick() {
        if (!running.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.debug("Skipping {} tick, previous run still in progress", name);
            return false;
        }
        try {
            worker.execute(this::runBody);
            return true;
        } catch (RejectedExecutionException e) {
            running.set(false);
            skippedTicks.incrementAndGet();
            log.warn("Worker for {} rejected the run: {}", name, e.getMessage());
            return false;
        }
    }

    private void runBody() {
        startedRuns.incrementAndGet();
        try {
            body.run();
            completedRuns.incrementAndGet();
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            log.error("{} run failed", name, e);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    public long getStartedRuns() {
        return startedRuns.get();
    }

    public long getCompletedRuns() {
        return completedRuns.get();
    }

    public long getFailedRuns() {
        return failedRuns.get();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }
}
