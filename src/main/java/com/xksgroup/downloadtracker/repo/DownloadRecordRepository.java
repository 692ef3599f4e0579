package com.xksgroup.downloadtracker.repo;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DownloadRecordRepository extends MongoRepository<DownloadRecord, String>, DownloadRecordRepositoryCustom {

    Optional<DownloadRecord> findByExternalId(String externalId);

    List<DownloadRecord> findByStatus(DownloadStatus status);

    List<DownloadRecord> findByStatusIn(Collection<DownloadStatus> statuses);

    List<DownloadRecord> findByPosterAttemptedFalse();

    long countByStatus(DownloadStatus status);
}
