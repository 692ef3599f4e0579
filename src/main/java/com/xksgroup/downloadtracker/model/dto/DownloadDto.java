package com.xksgroup.downloadtracker.model.dto;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.download.MediaMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * Flattened view of a download and its media match for API clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadDto {

    // Basic Info
    private String id;
    private String externalId;
    private String name;
    private String category;

    // Status & Progress
    private String status;
    private String detailedStatus;
    private double progress;
    private double speed;
    private Double sizeTotal;
    private Double sizeLeft;
    private String timeLeft;
    private Integer queuePosition;
    private String priority;

    // Media Info
    private String mediaTitle;
    private String mediaType;
    private Integer year;
    private Integer season;
    private Integer episode;
    private String posterUrl;
    private String sourceInstance;

    // Timing
    private Instant createdAt;
    private Instant completedAt;

    // Error Info
    private boolean failed;
    private String failureReason;

    public static DownloadDto fromRecord(DownloadRecord record) {
        DownloadDtoBuilder builder = DownloadDto.builder()
                .id(record.getId())
                .externalId(record.getExternalId())
                .name(record.getName())
                .category(record.getCategory())
                .status(record.getStatus() == null ? null : record.getStatus().name().toLowerCase(Locale.ROOT))
                .detailedStatus(record.getDetailedStatus())
                .progress(record.getProgress())
                .speed(record.getSpeed())
                .sizeTotal(record.getSizeTotal())
                .sizeLeft(record.getSizeLeft())
                .timeLeft(record.getTimeLeft())
                .queuePosition(record.getQueuePosition())
                .priority(record.getPriority() == null ? null : record.getPriority().getLabel())
                .createdAt(record.getCreatedAt())
                .completedAt(record.getCompletedAt())
                .failed(record.getStatus() == DownloadStatus.FAILED)
                .failureReason(record.getFailureReason());

        MediaMatch match = record.getMediaMatch();
        if (match != null) {
            builder.mediaTitle(match.getMediaTitle())
                    .mediaType(match.getMediaType() == null ? null : match.getMediaType().name().toLowerCase(Locale.ROOT))
                    .year(match.getYear())
                    .season(match.getSeason())
                    .episode(match.getEpisode())
                    .posterUrl(match.getPosterUrl())
                    .sourceInstance(match.getSourceInstance());
        }
        return builder.build();
    }
}
