package org.neuralchilli.planner.domain;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one evaluation pass.
 * Useful for monitoring and for dashboards that only need counts.
 */
public record EvaluationStatistics(
        int totalTasks,
        int nextActions,
        int waitingTasks,
        Map<BlockedReason, Integer> primaryReasons
) {
    public EvaluationStatistics {
        if (totalTasks < 0) {
            throw new IllegalArgumentException("Total tasks cannot be negative");
        }
        if (nextActions < 0) {
            throw new IllegalArgumentException("Next actions cannot be negative");
        }
        if (waitingTasks < 0) {
            throw new IllegalArgumentException("Waiting tasks cannot be negative");
        }
        primaryReasons = primaryReasons == null || primaryReasons.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(primaryReasons));
    }

    /**
     * Number of tasks whose primary reason is the given one
     */
    public int blockedBy(BlockedReason reason) {
        return primaryReasons.getOrDefault(reason, 0);
    }

    /**
     * Tasks carrying at least one reason
     */
    public int blockedTasks() {
        return primaryReasons.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean hasNextActions() {
        return nextActions > 0;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "EvaluationStatistics[tasks=%d, next=%d, waiting=%d, blocked=%d]",
                totalTasks, nextActions, waitingTasks, blockedTasks()
        );
    }
}
