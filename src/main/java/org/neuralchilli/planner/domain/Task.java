package org.neuralchilli.planner.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * A task as materialized by one loader pass.
 * Keyed by canonical id; rebuilt on every pass, never mutated.
 */
public record Task(
        TaskId id,
        String text,
        TaskStatus status,
        Instant startTime,
        Instant endTime,
        Instant completedTime,
        Double importance,  // 0-100, null means unset
        Double urgency,
        Double effort,
        boolean star,
        List<TaskId> dependsOn,
        DependencyMode dependsMode,
        Double dependencyDelayHours,
        TaskId parentTaskId,
        List<TaskId> childTaskIds
) {
    public Task {
        if (id == null) {
            throw new IllegalArgumentException("Task id cannot be null");
        }

        if (dependencyDelayHours != null && dependencyDelayHours < 0) {
            throw new IllegalArgumentException(
                    "Dependency delay cannot be negative, got: " + dependencyDelayHours
            );
        }

        // Defaults
        if (text == null) {
            text = "";
        }
        if (status == null) {
            status = TaskStatus.TODO;
        }
        if (dependsMode == null) {
            dependsMode = DependencyMode.ALL;
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependsOn));
        childTaskIds = childTaskIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(childTaskIds));
    }

    /**
     * Instant the task counts as completed at: the recorded completion time,
     * else its end time
     */
    public Optional<Instant> completionInstant() {
        return Optional.ofNullable(completedTime != null ? completedTime : endTime);
    }

    public boolean hasDependencyDelay() {
        return dependencyDelayHours != null && dependencyDelayHours > 0;
    }

    public Optional<TaskId> parent() {
        return Optional.ofNullable(parentTaskId);
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(long id) {
        return new Builder(TaskId.of(id));
    }

    public static Builder builder(TaskId id) {
        return new Builder(id);
    }

    public static class Builder {
        private final TaskId id;
        private String text = "";
        private TaskStatus status = TaskStatus.TODO;
        private Instant startTime;
        private Instant endTime;
        private Instant completedTime;
        private Double importance;
        private Double urgency;
        private Double effort;
        private boolean star = false;
        private List<TaskId> dependsOn = new ArrayList<>();
        private DependencyMode dependsMode = DependencyMode.ALL;
        private Double dependencyDelayHours;
        private TaskId parentTaskId;
        private List<TaskId> childTaskIds = new ArrayList<>();

        public Builder(TaskId id) {
            this.id = id;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder completedTime(Instant completedTime) {
            this.completedTime = completedTime;
            return this;
        }

        public Builder importance(Double importance) {
            this.importance = importance;
            return this;
        }

        public Builder urgency(Double urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder effort(Double effort) {
            this.effort = effort;
            return this;
        }

        public Builder star(boolean star) {
            this.star = star;
            return this;
        }

        public Builder dependsOn(List<TaskId> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder dependsOn(long... ids) {
            List<TaskId> list = new ArrayList<>();
            for (long value : ids) {
                list.add(TaskId.of(value));
            }
            this.dependsOn = list;
            return this;
        }

        public Builder dependsMode(DependencyMode dependsMode) {
            this.dependsMode = dependsMode;
            return this;
        }

        public Builder dependencyDelayHours(Double dependencyDelayHours) {
            this.dependencyDelayHours = dependencyDelayHours;
            return this;
        }

        public Builder parentTaskId(TaskId parentTaskId) {
            this.parentTaskId = parentTaskId;
            return this;
        }

        public Builder childTaskIds(List<TaskId> childTaskIds) {
            this.childTaskIds = childTaskIds;
            return this;
        }

        public Task build() {
            return new Task(id, text, status, startTime, endTime, completedTime,
                    importance, urgency, effort, star, dependsOn, dependsMode,
                    dependencyDelayHours, parentTaskId, childTaskIds);
        }
    }
}
