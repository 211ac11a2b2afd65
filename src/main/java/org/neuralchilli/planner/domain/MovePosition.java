package org.neuralchilli.planner.domain;

import java.util.Locale;

/**
 * Where a moved block lands relative to its target block.
 */
public enum MovePosition {
    /**
     * Sibling placed just before the target
     */
    BEFORE,

    /**
     * Sibling placed just after the target
     */
    AFTER,

    /**
     * Last child of the target
     */
    CHILD;

    public static MovePosition fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Move position is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("LAST_CHILD") || normalized.equals("LASTCHILD")) {
            return CHILD;
        }
        for (MovePosition position : values()) {
            if (position.name().equals(normalized)) {
                return position;
            }
        }
        throw new IllegalArgumentException("Unknown move position: " + value);
    }
}
