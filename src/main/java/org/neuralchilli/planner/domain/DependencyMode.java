package org.neuralchilli.planner.domain;

/**
 * How a task's declared dependencies combine.
 */
public enum DependencyMode {
    /**
     * Every dependency must be done
     */
    ALL,

    /**
     * One done dependency is enough
     */
    ANY;

    /**
     * Lenient parse: {@code ANY} in any case selects ANY, everything else is ALL
     */
    public static DependencyMode fromString(String value) {
        if (value != null && value.trim().equalsIgnoreCase("ANY")) {
            return ANY;
        }
        return ALL;
    }
}
