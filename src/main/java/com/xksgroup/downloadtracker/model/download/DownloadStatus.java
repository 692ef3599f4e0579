package com.xksgroup.downloadtracker.model.download;

import java.util.List;

public enum DownloadStatus {
    QUEUED(0),       // Waiting in the controller queue
    DOWNLOADING(1),  // Active slot, or post-processing in history
    COMPLETED(2),    // Terminal
    FAILED(2);       // Terminal

    public static final List<DownloadStatus> TERMINAL = List.of(COMPLETED, FAILED);
    public static final List<DownloadStatus> ACTIVE = List.of(QUEUED, DOWNLOADING);

    private final int rank;

    DownloadStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    /**
     * Status transitions only move forward: queued, downloading, then completed or failed.
     */
    public boolean canMoveTo(DownloadStatus next) {
        return next == this || next.rank > this.rank;
    }
}
