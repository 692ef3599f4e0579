package com.xksgroup.downloadtracker.service.client;

import com.xksgroup.downloadtracker.exception.DownloadClientException;
import com.xksgroup.downloadtracker.model.snapshot.HistoryItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueItem;

import java.util.List;

/**
 * The download controller as seen by the tracker.
 */
public interface DownloadQueueSource {

    List<QueueItem> fetchQueue() throws DownloadClientException;

    List<HistoryItem> fetchHistory() throws DownloadClientException;

    /**
     * @throws DownloadClientException when the controller is unreachable or refuses the change
     */
    void setPriority(String externalId, int code) throws DownloadClientException;
}
