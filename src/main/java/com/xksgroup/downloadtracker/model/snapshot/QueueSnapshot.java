package com.xksgroup.downloadtracker.model.snapshot;

import java.util.List;

/**
 * Queue and history as fetched in one reconciliation cycle.
 */
public record QueueSnapshot(List<QueueItem> queue, List<HistoryItem> history) {

    public QueueSnapshot {
        queue = queue == null ? List.of() : List.copyOf(queue);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public int size() {
        return queue.size() + history.size();
    }
}
