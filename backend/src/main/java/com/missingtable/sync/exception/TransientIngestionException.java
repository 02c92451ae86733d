package com.missingtable.sync.exception;

/**
 * Storage or network trouble that may succeed on a later attempt.
 */
public class TransientIngestionException extends IngestionException {

    public TransientIngestionException(String message) {
        super(message);
    }

    public TransientIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
