package org.neuralchilli.planner.domain;

import java.time.Instant;
import java.util.List;

/**
 * Decoded, default-filled task payload of one block.
 * Raw ids in {@code dependsOn} are not canonicalized yet.
 */
public record TaskPropertyValues(
        TaskStatus status,
        Instant startTime,
        Instant endTime,
        Instant completedTime,
        Double importance,
        Double urgency,
        Double effort,
        boolean star,
        List<Long> dependsOn,
        DependencyMode dependsMode,
        Double dependencyDelayHours
) {
    public TaskPropertyValues {
        if (status == null) {
            status = TaskStatus.TODO;
        }
        if (dependsMode == null) {
            dependsMode = DependencyMode.ALL;
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    /**
     * Schema defaults: a todo task with nothing else set
     */
    public static TaskPropertyValues defaults() {
        return new TaskPropertyValues(
                TaskStatus.TODO, null, null, null,
                null, null, null,
                false, List.of(), DependencyMode.ALL, null
        );
    }
}
