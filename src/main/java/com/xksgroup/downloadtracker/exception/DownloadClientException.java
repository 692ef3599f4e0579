package com.xksgroup.downloadtracker.exception;

/**
 * The download controller could not be reached or answered with an error.
 */
public class DownloadClientException extends RuntimeException {
    public DownloadClientException(String message) {
        super(message);
    }

    public DownloadClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
