package com.xksgroup.downloadtracker.service;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.dto.StatsDto;
import com.xksgroup.downloadtracker.repo.DownloadRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side plus the administrative poster reset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadQueryService {

    private final DownloadRecordRepository downloadRecordRepository;

    public List<DownloadRecord> listAll() {
        return downloadRecordRepository.findAll();
    }

    public List<DownloadRecord> listByStatus(DownloadStatus status) {
        return downloadRecordRepository.findByStatus(status);
    }

    public StatsDto stats() {
        List<DownloadRecord> records = downloadRecordRepository.findAll();
        long downloading = 0;
        long queued = 0;
        long completed = 0;
        long failed = 0;
        double totalSpeed = 0.0;

        for (DownloadRecord record : records) {
            if (record.getStatus() == null) {
                continue;
            }
            switch (record.getStatus()) {
                case DOWNLOADING -> {
                    downloading++;
                    totalSpeed += record.getSpeed();
                }
                case QUEUED -> queued++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }

        return StatsDto.builder()
                .downloading(downloading)
                .queued(queued)
                .completed(completed)
                .failed(failed)
                .totalSpeed(Math.round(totalSpeed * 100.0) / 100.0)
                .build();
    }

    /**
     * Makes every record eligible for one more automatic lookup, for instance after
     * the matching rules changed.
     */
    public long resetPosterFlags() {
        long count = downloadRecordRepository.resetPosterAttempted();
        log.info("Poster flags reset on {} downloads, they will be matched again on the next sync", count);
        return count;
    }
}
