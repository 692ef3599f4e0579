package com.xksgroup.downloadtracker.model.snapshot;

import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of the controller's history. Entries still in post-processing
 * report {@link DownloadStatus#DOWNLOADING}.
 */
@Value
@Builder
public class HistoryItem {
    String externalId;
    String name;
    DownloadStatus status;
    String detailedStatus;
    double sizeTotal;
    String category;
    Instant completedAt;
    String failureReason;

    public boolean isFailed() {
        return status == DownloadStatus.FAILED;
    }
}
