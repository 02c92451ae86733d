package com.missingtable.sync.exception;

public class UnknownReferenceException extends ValidationException {

    public UnknownReferenceException(String field, String identifier) {
        super(field, "does not match any known record: '" + identifier + "'");
    }
}
