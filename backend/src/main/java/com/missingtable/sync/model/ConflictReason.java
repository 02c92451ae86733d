package com.missingtable.sync.model;

public enum ConflictReason {
    /** Automated data disagrees with a locked (manually scored) match. */
    LOCKED_DIVERGENCE,
    /** The requested status change is outside the allowed edge set. */
    INVALID_TRANSITION
}
