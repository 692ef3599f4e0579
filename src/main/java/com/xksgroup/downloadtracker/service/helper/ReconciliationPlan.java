package com.xksgroup.downloadtracker.service.helper;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.SyncFields;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Mutations computed for one snapshot. Nothing is written until the plan is applied.
 */
@Value
@Builder
public class ReconciliationPlan {

    @Singular
    List<DownloadRecord> inserts;

    @Singular
    List<RecordUpdate> updates;

    // Queued records removed from the controller (cancellations)
    @Singular
    List<String> deletions;

    int completedTransitions;
    int failedTransitions;

    public record RecordUpdate(String id, String externalId, SyncFields fields) {
    }

    public int mutationCount() {
        return inserts.size() + updates.size() + deletions.size();
    }

    public boolean isEmpty() {
        return mutationCount() == 0;
    }
}
