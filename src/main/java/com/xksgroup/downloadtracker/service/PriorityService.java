package com.xksgroup.downloadtracker.service;

import com.xksgroup.downloadtracker.exception.DownloadClientException;
import com.xksgroup.downloadtracker.exception.PriorityChangeRejectedException;
import com.xksgroup.downloadtracker.exception.PriorityChangeRejectedException.Reason;
import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.download.Priority;
import com.xksgroup.downloadtracker.repo.DownloadRecordRepository;
import com.xksgroup.downloadtracker.service.client.DownloadQueueSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * User-issued priority changes. Only queued downloads can be reprioritised.
 * The local value is written optimistically; the next sync overwrites it with
 * whatever the controller reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriorityService {

    private final DownloadRecordRepository downloadRecordRepository;
    private final DownloadQueueSource queueSource;

    public DownloadRecord updatePriority(String downloadId, String label) {
        DownloadRecord record = downloadRecordRepository.findById(downloadId)
                .orElseThrow(() -> new PriorityChangeRejectedException(Reason.NOT_FOUND, downloadId,
                        "Download not found: " + downloadId));

        Priority priority;
        try {
            priority = Priority.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new PriorityChangeRejectedException(Reason.INVALID_LABEL, downloadId, e.getMessage(), e);
        }

        if (record.getStatus() != DownloadStatus.QUEUED) {
            throw new PriorityChangeRejectedException(Reason.INVALID_STATE, downloadId,
                    "Priority can only be changed on queued downloads, this one is " + record.getStatus());
        }

        try {
            queueSource.setPriority(record.getExternalId(), priority.getCode());
        } catch (DownloadClientException e) {
            log.warn("Controller rejected priority {} for {}: {}", priority.getLabel(), record.getExternalId(), e.getMessage());
            throw new PriorityChangeRejectedException(Reason.CONTROLLER_REJECTED, downloadId, e.getMessage(), e);
        }

        downloadRecordRepository.setPriority(record.getId(), priority);
        record.setPriority(priority);

        log.info("Priority of '{}' set to {} ({})", record.getName(), priority.getLabel(), priority.getCode());
        return record;
    }
}
