package com.missingtable.sync.exception;

/**
 * Root of the failures raised while a match message moves through the ingestion pipeline.
 */
public abstract class IngestionException extends RuntimeException {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
