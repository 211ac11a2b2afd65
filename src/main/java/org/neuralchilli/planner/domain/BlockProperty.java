package org.neuralchilli.planner.domain;

/**
 * A typed property on a block or in a tag reference payload.
 * The value is whatever the host stored; readers must not trust its runtime type.
 */
public record BlockProperty(
        String name,
        PropertyType type,
        Object value
) {
    public BlockProperty {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name cannot be null or empty");
        }
        if (type == null) {
            type = PropertyType.TEXT;
        }
    }

    public static BlockProperty of(String name, PropertyType type, Object value) {
        return new BlockProperty(name, type, value);
    }
}
