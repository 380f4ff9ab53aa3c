package com.enterprise.orchestration.bus;

import com.enterprise.orchestration.exception.ValidationException;

/**
 * Message priority. Informational only, delivery order is publish order.
 */
public enum Priority {
    HIGH("high"),
    NORMAL("normal"),
    LOW("low");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new ValidationException("Unknown priority: " + raw);
    }
}
