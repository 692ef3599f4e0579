package com.xksgroup.downloadtracker.exception;

import lombok.Getter;

/**
 * A priority change that was refused before or by the controller. Local state is unchanged.
 */
@Getter
public class PriorityChangeRejectedException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        INVALID_STATE,
        INVALID_LABEL,
        CONTROLLER_REJECTED
    }

    private final Reason reason;
    private final String downloadId;

    public PriorityChangeRejectedException(Reason reason, String downloadId, String message) {
        super(message);
        this.reason = reason;
        this.downloadId = downloadId;
    }

    public PriorityChangeRejectedException(Reason reason, String downloadId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.downloadId = downloadId;
    }
}
