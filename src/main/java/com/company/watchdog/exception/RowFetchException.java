package com.company.watchdog.exception;

public class RowFetchException extends RuntimeException {
    public RowFetchException(String message) {
        super(message);
    }

    public RowFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
