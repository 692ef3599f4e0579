package com.xksgroup.downloadtracker.exception;

public class LibraryLookupException extends RuntimeException {
    public LibraryLookupException(String message) {
        super(message);
    }

    public LibraryLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
