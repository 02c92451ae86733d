package com.missingtable.sync.exception;

public class PermanentIngestionException extends IngestionException {

    public PermanentIngestionException(String message) {
        super(message);
    }

    public PermanentIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
