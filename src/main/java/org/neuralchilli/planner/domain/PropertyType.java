package org.neuralchilli.planner.domain;

/**
 * Type codes of typed block properties, as the host encodes them.
 */
public enum PropertyType {
    JSON(0),
    TEXT(1),
    BLOCK_REFS(2),
    NUMBER(3),
    BOOLEAN(4),
    DATE_TIME(5),
    TEXT_CHOICES(6);

    private final int code;

    PropertyType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolve a host type code. Unknown codes are treated as plain text.
     */
    public static PropertyType fromCode(int code) {
        for (PropertyType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return TEXT;
    }

    /**
     * Parse type from string (case-insensitive), as written in snapshot files
     */
    public static PropertyType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Property type cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid property type: " + value +
                            ". Valid types: json, text, block_refs, number, boolean, date_time, text_choices"
            );
        }
    }
}
