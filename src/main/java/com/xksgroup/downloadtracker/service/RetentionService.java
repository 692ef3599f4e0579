package com.xksgroup.downloadtracker.service;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.dto.RetentionReport;
import com.xksgroup.downloadtracker.repo.DownloadRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Deletes completed and failed downloads once they are older than the retention window.
 * This is the only place terminal records are removed.
 */
@Slf4j
@Service
public class RetentionService {

    private final DownloadRecordRepository downloadRecordRepository;
    private final Clock clock;
    private final Duration retention;

    public RetentionService(DownloadRecordRepository downloadRecordRepository,
                            Clock clock,
                            @Value("${tracker.cleanup.completed-after-hours:48}") long retentionHours) {
        if (retentionHours < 0) {
            throw new IllegalArgumentException("Retention hours cannot be negative: " + retentionHours);
        }
        this.downloadRecordRepository = downloadRecordRepository;
        this.clock = clock;
        this.retention = Duration.ofHours(retentionHours);
    }

    public RetentionReport purgeExpired() {
        Instant now = clock.instant();
        List<DownloadRecord> terminal = downloadRecordRepository.findByStatusIn(DownloadStatus.TERMINAL);

        List<String> expiredIds = new ArrayList<>();
        RetentionReport.RetentionReportBuilder report = RetentionReport.builder().retentionHours(retention.toHours());
        for (DownloadRecord record : terminal) {
            if (isExpired(record, now)) {
                expiredIds.add(record.getId());
                report.removedItem(describe(record, now));
            }
        }

        if (!expiredIds.isEmpty()) {
            // One remove with an $in filter
            downloadRecordRepository.deleteAllById(expiredIds);
        }

        RetentionReport result = report.removed(expiredIds.size()).kept(terminal.size() - expiredIds.size()).build();
        if (result.getRemoved() > 0) {
            log.info("Cleanup: removed {} of {} finished downloads older than {}h, kept {}",
                    result.getRemoved(), terminal.size(), result.getRetentionHours(), result.getKept());
            result.getRemovedItems().forEach(item -> log.info("  - {}", item));
        } else {
            log.debug("Cleanup: nothing older than {}h ({} finished downloads kept)", result.getRetentionHours(), result.getKept());
        }
        return result;
    }

    /**
     * Completed and failed records expire alike once {@code completedAt} is further
     * in the past than the retention window.
     */
    public boolean isExpired(DownloadRecord record, Instant now) {
        if (!record.isTerminal() || record.getCompletedAt() == null) {
            return false;
        }
        return Duration.between(record.getCompletedAt(), now).compareTo(retention) > 0;
    }

    private static String describe(DownloadRecord record, Instant now) {
        String name = record.getMediaMatch() != null && record.getMediaMatch().getMediaTitle() != null
                ? record.getMediaMatch().getMediaTitle()
                : record.getName();
        if (name != null && name.length() > 40) {
            name = name.substring(0, 40);
        }
        long hoursAgo = Duration.between(record.getCompletedAt(), now).toHours();
        return String.format("[%s] %s (%dh ago)", record.getStatus(), name, hoursAgo);
    }
}
