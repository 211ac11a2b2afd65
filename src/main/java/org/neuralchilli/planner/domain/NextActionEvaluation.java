package org.neuralchilli.planner.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Readiness and score of one task in one evaluation pass.
 */
public record NextActionEvaluation(
        Task task,
        boolean isNextAction,
        Set<BlockedReason> blockedReason,
        double score
) {
    public NextActionEvaluation {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        blockedReason = blockedReason == null || blockedReason.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(BlockedReason.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(blockedReason));
        if (isNextAction && !blockedReason.isEmpty()) {
            throw new IllegalArgumentException(
                    "A next action cannot carry blocked reasons: " + blockedReason
            );
        }
    }

    public TaskId id() {
        return task.id();
    }

    public String text() {
        return task.text();
    }

    public Instant endTime() {
        return task.endTime();
    }

    public Optional<BlockedReason> primaryReason() {
        return BlockedReason.primary(blockedReason);
    }

    public boolean isBlocked() {
        return !blockedReason.isEmpty();
    }
}
