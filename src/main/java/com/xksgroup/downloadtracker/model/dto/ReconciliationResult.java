package com.xksgroup.downloadtracker.model.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one reconciliation cycle.
 */
@Value
@Builder
public class ReconciliationResult {
    boolean aborted;
    String abortReason;
    int inserted;
    int updated;
    int deleted;
    int completedTransitions;
    int failedTransitions;
    int downloading;
    int queued;
    int completed;

    public static ReconciliationResult aborted(String reason) {
        return ReconciliationResult.builder().aborted(true).abortReason(reason).build();
    }

    public int mutationCount() {
        return inserted + updated + deleted;
    }
}
