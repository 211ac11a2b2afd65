package org.neuralchilli.planner.api;

import java.time.Instant;
import java.util.List;

/**
 * Request bodies of the task mutation endpoints.
 */
public final class TaskRequests {

    private TaskRequests() {
    }

    /**
     * Status as its name (TODO, DOING, ...) or as one of the schema's labels
     */
    public record StatusRequest(String status) {
    }

    public record StarRequest(boolean star) {
    }

    public record DependenciesRequest(List<Long> dependsOn, String mode, Double delayHours) {
    }

    public record ScheduleRequest(Instant startTime, Instant endTime) {
    }

    public record PriorityRequest(Double importance, Double urgency, Double effort) {
    }

    public record SubtaskRequest(String text) {
    }

    /**
     * Position is {@code before}, {@code after} or {@code child} of the target block
     */
    public record MoveRequest(Long target, String position) {
    }
}
