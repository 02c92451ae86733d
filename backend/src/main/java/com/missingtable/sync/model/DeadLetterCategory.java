package com.missingtable.sync.model;

public enum DeadLetterCategory {
    VALIDATION("validation"),
    EXHAUSTED_RETRIES("exhausted-retries"),
    PERMANENT_FAILURE("permanent-failure");

    private final String label;

    DeadLetterCategory(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
