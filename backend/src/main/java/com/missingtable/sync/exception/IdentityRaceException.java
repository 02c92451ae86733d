package com.missingtable.sync.exception;

/**
 * Another worker wrote the same match between our read and our conditional write.
 * Re-running the unit of work re-resolves identity against the winner's row.
 */
public class IdentityRaceException extends TransientIngestionException {

    public IdentityRaceException(String message) {
        super(message);
    }

    public IdentityRaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
