package com.xksgroup.downloadtracker.service.helper;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.download.Priority;
import com.xksgroup.downloadtracker.model.download.SyncFields;
import com.xksgroup.downloadtracker.model.snapshot.HistoryItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Diffs a controller snapshot against the persisted records.
 * <ul>
 *     <li>unknown items are inserted with the status of the list they came from</li>
 *     <li>known active records take the snapshot's values; status never moves backwards</li>
 *     <li>terminal records are frozen</li>
 *     <li>active records missing from the snapshot are only resolved after
 *     {@code missThreshold} consecutive misses: queued ones are deleted, downloading
 *     ones fail</li>
 * </ul>
 * Planning the same snapshot twice yields an empty second plan.
 */
@Slf4j
public class ReconciliationPlanner {

    static final String REMOVED_REASON = "Removed from download client";

    private final int missThreshold;

    public ReconciliationPlanner(int missThreshold) {
        if (missThreshold < 1) {
            throw new IllegalArgumentException("missThreshold must be at least 1, got " + missThreshold);
        }
        this.missThreshold = missThreshold;
    }

    public ReconciliationPlan plan(List<DownloadRecord> persisted, QueueSnapshot snapshot, Instant now) {
        // History wins when an item shows up in both lists mid-transition
        Map<String, Object> entries = new LinkedHashMap<>();
        for (QueueItem item : snapshot.queue()) {
            if (item.getExternalId() != null && !item.getExternalId().isBlank()) {
                entries.put(item.getExternalId(), item);
            }
        }
        for (HistoryItem item : snapshot.history()) {
            if (item.getExternalId() != null && !item.getExternalId().isBlank()) {
                entries.put(item.getExternalId(), item);
            }
        }

        Map<String, DownloadRecord> byExternalId = new LinkedHashMap<>();
        for (DownloadRecord record : persisted) {
            byExternalId.put(record.getExternalId(), record);
        }

        ReconciliationPlan.ReconciliationPlanBuilder plan = ReconciliationPlan.builder();
        int completed = 0;
        int failed = 0;

        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            DownloadRecord existing = byExternalId.get(entry.getKey());
            if (existing == null) {
                DownloadRecord created = newRecord(entry.getValue(), now);
                plan.insert(created);
                if (created.getStatus() == DownloadStatus.COMPLETED) completed++;
                if (created.getStatus() == DownloadStatus.FAILED) failed++;
                continue;
            }
            if (existing.isTerminal()) {
                continue;
            }

            SyncFields current = SyncFields.of(existing);
            SyncFields target = entry.getValue() instanceof QueueItem queueItem
                    ? fromQueue(current, queueItem)
                    : fromHistory(current, (HistoryItem) entry.getValue(), now);

            if (!target.equals(current)) {
                plan.update(new ReconciliationPlan.RecordUpdate(existing.getId(), existing.getExternalId(), target));
                if (target.getStatus() != current.getStatus()) {
                    if (target.getStatus() == DownloadStatus.COMPLETED) completed++;
                    if (target.getStatus() == DownloadStatus.FAILED) failed++;
                }
            }
        }

        for (DownloadRecord record : persisted) {
            if (record.isTerminal() || entries.containsKey(record.getExternalId())) {
                continue;
            }
            int misses = record.getConsecutiveMisses() + 1;
            SyncFields current = SyncFields.of(record);

            if (misses < missThreshold) {
                plan.update(new ReconciliationPlan.RecordUpdate(record.getId(), record.getExternalId(),
                        current.toBuilder().consecutiveMisses(misses).build()));
            } else if (record.getStatus() == DownloadStatus.QUEUED) {
                log.info("Cancelled: {} (absent for {} cycles)", record.getName(), misses);
                plan.deletion(record.getId());
            } else {
                log.info("Orphaned: {} (absent for {} cycles)", record.getName(), misses);
                plan.update(new ReconciliationPlan.RecordUpdate(record.getId(), record.getExternalId(),
                        current.toBuilder()
                                .status(DownloadStatus.FAILED)
                                .failureReason(REMOVED_REASON)
                                .completedAt(now)
                                .speed(0.0)
                                .queuePosition(null)
                                .consecutiveMisses(misses)
                                .build()));
                failed++;
            }
        }

        return plan.completedTransitions(completed).failedTransitions(failed).build();
    }

    private SyncFields fromQueue(SyncFields current, QueueItem item) {
        DownloadStatus status = current.getStatus().canMoveTo(item.getStatus()) ? item.getStatus() : current.getStatus();
        return current.toBuilder()
                .name(item.getName())
                .status(status)
                .detailedStatus(item.getDetailedStatus())
                .progress(item.getProgress())
                .speed(item.getSpeed())
                .sizeTotal(item.getSizeTotal())
                .sizeLeft(item.getSizeLeft())
                .timeLeft(item.getTimeLeft())
                .queuePosition(item.getQueuePosition())
                .category(item.getCategory())
                .priority(reportedPriority(item))
                .consecutiveMisses(0)
                .build();
    }

    private SyncFields fromHistory(SyncFields current, HistoryItem item, Instant now) {
        DownloadStatus status = current.getStatus().canMoveTo(item.getStatus()) ? item.getStatus() : current.getStatus();
        SyncFields.SyncFieldsBuilder target = current.toBuilder()
                .name(item.getName())
                .status(status)
                .detailedStatus(item.getDetailedStatus())
                .speed(0.0)
                .sizeTotal(item.getSizeTotal())
                .timeLeft(null)
                .queuePosition(null)
                .category(item.getCategory())
                .consecutiveMisses(0);

        if (status.isTerminal()) {
            target.progress(status == DownloadStatus.COMPLETED ? 100.0 : current.getProgress())
                    .sizeLeft(status == DownloadStatus.COMPLETED ? 0.0 : current.getSizeLeft())
                    .failureReason(item.getFailureReason())
                    .completedAt(current.getCompletedAt() != null ? current.getCompletedAt() : completionTime(item, now));
        } else {
            // Post-processing: the payload is fully downloaded
            target.progress(100.0).sizeLeft(0.0);
        }
        return target.build();
    }

    private DownloadRecord newRecord(Object item, Instant now) {
        DownloadRecord record = DownloadRecord.builder()
                .id("dl-" + UUID.randomUUID())
                .createdAt(now)
                .consecutiveMisses(0)
                .posterAttempted(false)
                .build();

        if (item instanceof QueueItem queueItem) {
            record.setExternalId(queueItem.getExternalId());
            record.setName(queueItem.getName());
            record.setStatus(queueItem.getStatus());
            record.setDetailedStatus(queueItem.getDetailedStatus());
            record.setProgress(queueItem.getProgress());
            record.setSpeed(queueItem.getSpeed());
            record.setSizeTotal(queueItem.getSizeTotal());
            record.setSizeLeft(queueItem.getSizeLeft());
            record.setTimeLeft(queueItem.getTimeLeft());
            record.setQueuePosition(queueItem.getQueuePosition());
            record.setCategory(queueItem.getCategory());
            record.setPriority(reportedPriority(queueItem));
        } else {
            HistoryItem historyItem = (HistoryItem) item;
            record.setExternalId(historyItem.getExternalId());
            record.setName(historyItem.getName());
            record.setStatus(historyItem.getStatus());
            record.setDetailedStatus(historyItem.getDetailedStatus());
            record.setSizeTotal(historyItem.getSizeTotal());
            record.setCategory(historyItem.getCategory());
            record.setSizeLeft(0.0);
            record.setProgress(historyItem.getStatus() == DownloadStatus.FAILED ? 0.0 : 100.0);
            if (historyItem.getStatus().isTerminal()) {
                record.setFailureReason(historyItem.getFailureReason());
                record.setCompletedAt(completionTime(historyItem, now));
            }
        }
        return record;
    }

    private static Instant completionTime(HistoryItem item, Instant now) {
        return item.getCompletedAt() != null ? item.getCompletedAt() : now;
    }

    private static Priority reportedPriority(QueueItem item) {
        if (item.getPriority() == null) {
            return null;
        }
        Priority priority = Priority.fromReported(item.getPriority()).orElse(null);
        if (priority == null) {
            log.warn("Unknown priority '{}' reported for {}", item.getPriority(), item.getExternalId());
        }
        return priority;
    }
}
