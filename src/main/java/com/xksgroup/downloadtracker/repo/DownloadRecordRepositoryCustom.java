package com.xksgroup.downloadtracker.repo;

import com.xksgroup.downloadtracker.model.download.MediaMatch;
import com.xksgroup.downloadtracker.model.download.Priority;
import com.xksgroup.downloadtracker.model.download.SyncFields;

/**
 * Field-group writes. Each method touches one group only so reconciliation and
 * enrichment never overwrite each other's fields.
 */
public interface DownloadRecordRepositoryCustom {

    /**
     * Writes the reconciliation-owned fields of one record.
     */
    void applySyncFields(String id, SyncFields fields);

    /**
     * Optimistic write of a user-requested priority. Reconciliation may overwrite it.
     */
    void setPriority(String id, Priority priority);

    /**
     * Atomically flips {@code posterAttempted} from false to true.
     *
     * @return true when this caller performed the flip and owns the lookup
     */
    boolean claimForEnrichment(String id);

    void saveMediaMatch(String id, MediaMatch match);

    /**
     * Clears {@code posterAttempted} on every record.
     *
     * @return number of records changed
     */
    long resetPosterAttempted();
}
