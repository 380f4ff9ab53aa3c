package com.enterprise.orchestration.core;

import com.enterprise.orchestration.exception.ValidationException;

import java.util.Locale;

/**
 * Coarse complexity rating shared by tasks, workflows and phase templates
 */
public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    public static Complexity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown complexity: " + raw);
        }
    }
}
