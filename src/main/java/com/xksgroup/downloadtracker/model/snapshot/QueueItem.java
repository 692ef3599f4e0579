package com.xksgroup.downloadtracker.model.snapshot;

import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import lombok.Builder;
import lombok.Value;

/**
 * One slot of the controller's active queue.
 */
@Value
@Builder
public class QueueItem {
    String externalId;
    String name;
    DownloadStatus status;          // QUEUED or DOWNLOADING
    String detailedStatus;
    double progress;
    double speed;
    double sizeTotal;
    double sizeLeft;
    String timeLeft;
    String category;
    String priority;                // as reported, label or numeric string
    int queuePosition;
}
