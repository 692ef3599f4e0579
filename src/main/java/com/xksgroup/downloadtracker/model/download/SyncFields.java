package com.xksgroup.downloadtracker.model.download;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The field group owned by reconciliation. Two values are equal when a record
 * needs no write for this cycle.
 */
@Value
@Builder(toBuilder = true)
public class SyncFields {
    String name;
    DownloadStatus status;
    String detailedStatus;
    double progress;
    double speed;
    Double sizeTotal;
    Double sizeLeft;
    String timeLeft;
    Integer queuePosition;
    String category;
    Priority priority;
    String failureReason;
    Instant completedAt;
    int consecutiveMisses;

    public static SyncFields of(DownloadRecord record) {
        return SyncFields.builder()
                .name(record.getName())
                .status(record.getStatus())
                .detailedStatus(record.getDetailedStatus())
                .progress(record.getProgress())
                .speed(record.getSpeed())
                .sizeTotal(record.getSizeTotal())
                .sizeLeft(record.getSizeLeft())
                .timeLeft(record.getTimeLeft())
                .queuePosition(record.getQueuePosition())
                .category(record.getCategory())
                .priority(record.getPriority())
                .failureReason(record.getFailureReason())
                .completedAt(record.getCompletedAt())
                .consecutiveMisses(record.getConsecutiveMisses())
                .build();
    }

    public void applyTo(DownloadRecord record) {
        record.setName(name);
        record.setStatus(status);
        record.setDetailedStatus(detailedStatus);
        record.setProgress(progress);
        record.setSpeed(speed);
        record.setSizeTotal(sizeTotal);
        record.setSizeLeft(sizeLeft);
        record.setTimeLeft(timeLeft);
        record.setQueuePosition(queuePosition);
        record.setCategory(category);
        record.setPriority(priority);
        record.setFailureReason(failureReason);
        record.setCompletedAt(completedAt);
        record.setConsecutiveMisses(consecutiveMisses);
    }
}
