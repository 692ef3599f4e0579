package com.xksgroup.downloadtracker.service;

import com.xksgroup.downloadtracker.exception.DownloadClientException;
import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.dto.ReconciliationResult;
import com.xksgroup.downloadtracker.model.snapshot.HistoryItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueSnapshot;
import com.xksgroup.downloadtracker.repo.DownloadRecordRepository;
import com.xksgroup.downloadtracker.service.client.DownloadQueueSource;
import com.xksgroup.downloadtracker.service.helper.ReconciliationPlan;
import com.xksgroup.downloadtracker.service.helper.ReconciliationPlanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Fetches the controller's queue and history and merges them into the store.
 * Callers serialise cycles; see {@link SyncScheduler}.
 */
@Slf4j
@Service
public class ReconciliationService {

    private final DownloadQueueSource queueSource;
    private final DownloadRecordRepository downloadRecordRepository;
    private final ReconciliationPlanner planner;
    private final Clock clock;

    public ReconciliationService(DownloadQueueSource queueSource,
                                 DownloadRecordRepository downloadRecordRepository,
                                 Clock clock,
                                 @Value("${tracker.sync.miss-threshold:3}") int missThreshold) {
        this.queueSource = queueSource;
        this.downloadRecordRepository = downloadRecordRepository;
        this.clock = clock;
        this.planner = new ReconciliationPlanner(missThreshold);
    }

    /**
     * Runs one cycle. A fetch failure aborts before anything is written.
     */
    public ReconciliationResult runCycle() {
        QueueSnapshot snapshot;
        try {
            List<QueueItem> queue = queueSource.fetchQueue();
            List<HistoryItem> history = queueSource.fetchHistory();
            snapshot = new QueueSnapshot(queue, history);
        } catch (DownloadClientException e) {
            log.warn("Sync aborted, download client unavailable: {}", e.getMessage());
            return ReconciliationResult.aborted(e.getMessage());
        }

        List<DownloadRecord> persisted = downloadRecordRepository.findAll();
        ReconciliationPlan plan = planner.plan(persisted, snapshot, clock.instant());
        apply(plan);

        ReconciliationResult result = ReconciliationResult.builder()
                .inserted(plan.getInserts().size())
                .updated(plan.getUpdates().size())
                .deleted(plan.getDeletions().size())
                .completedTransitions(plan.getCompletedTransitions())
                .failedTransitions(plan.getFailedTransitions())
                .downloading(count(snapshot.queue(), DownloadStatus.DOWNLOADING))
                .queued(count(snapshot.queue(), DownloadStatus.QUEUED))
                .completed((int) snapshot.history().stream().filter(item -> item.getStatus() == DownloadStatus.COMPLETED).count())
                .build();

        if (plan.isEmpty()) {
            log.debug("Sync: no changes ({} items)", snapshot.size());
        } else {
            log.info("Sync: {} downloading, {} queued, {} completed | +{} new, {} updated, {} removed, {} completed, {} failed",
                    result.getDownloading(), result.getQueued(), result.getCompleted(),
                    result.getInserted(), result.getUpdated(), result.getDeleted(),
                    result.getCompletedTransitions(), result.getFailedTransitions());
        }
        return result;
    }

    /**
     * Each write targets one document, so an interrupted cycle leaves every record
     * either fully updated or untouched.
     */
    private void apply(ReconciliationPlan plan) {
        if (!plan.getInserts().isEmpty()) {
            downloadRecordRepository.insert(plan.getInserts());
        }
        for (ReconciliationPlan.RecordUpdate update : plan.getUpdates()) {
            downloadRecordRepository.applySyncFields(update.id(), update.fields());
        }
        if (!plan.getDeletions().isEmpty()) {
            downloadRecordRepository.deleteAllById(plan.getDeletions());
        }
    }

    private static int count(List<QueueItem> items, DownloadStatus status) {
        return (int) items.stream().filter(item -> item.getStatus() == status).count();
    }
}
