package com.enterprise.orchestration.sync;

import com.enterprise.orchestration.exception.ValidationException;

/**
 * How a write based on a stale version is reconciled with the stored value
 */
public enum ConflictStrategy {
    /**
     * Shallow-merge object fields; the stored value wins on key collisions
     */
    MERGE,
    /**
     * Keep whichever value carries the newer {@code _timestamp}
     */
    LATEST,
    /**
     * Ask an external resolver, bounded by the manual resolution timeout
     */
    MANUAL;

    public static ConflictStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MERGE;
        }
        try {
            return valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown conflict strategy: " + raw);
        }
    }
}
