package org.neuralchilli.planner.domain;

import javax.annotation.Nonnull;
import java.io.Serializable;

/**
 * Canonical identity of a logical task.
 * All mirrored block records of one task share the same TaskId.
 */
public record TaskId(long value) implements Comparable<TaskId>, Serializable {

    public static TaskId of(long value) {
        return new TaskId(value);
    }

    @Override
    public int compareTo(TaskId other) {
        return Long.compare(value, other.value);
    }

    @Nonnull
    @Override
    public String toString() {
        return "TaskId[" + value + "]";
    }
}
