package com.xksgroup.downloadtracker.model.download;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "downloads")
public class DownloadRecord {
    @Id
    private String id;

    // Key reported by the download controller (nzo_id)
    @Indexed(unique = true)
    private String externalId;

    private String name;
    private DownloadStatus status;
    private String detailedStatus;

    // Progress tracking
    private double progress;
    private double speed;        // MB/s
    private Double sizeTotal;    // MB
    private Double sizeLeft;     // MB
    private String timeLeft;
    private Integer queuePosition;

    private String category;
    private Priority priority;

    // Failure information
    private String failureReason;

    private Instant createdAt;
    private Instant completedAt;

    // Cycles in a row the record was absent from the controller snapshot
    private int consecutiveMisses;

    // Enrichment, owned by the media matcher
    private boolean posterAttempted;
    private MediaMatch mediaMatch;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
