package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.planner.domain.BlockedReason;
import org.neuralchilli.planner.domain.DependencyMode;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.BinaryOperator;

/**
 * Decides, for every task in a {@link TaskSet}, which reasons keep it from
 * being a next action.
 *
 * Tasks are visited parents first so a parent's dependency state is final
 * before its children inherit it. Dependency checks only read the status of
 * neighbouring tasks, so dependency cycles need no special handling.
 */
@ApplicationScoped
public class ReadinessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReadinessEvaluator.class);

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    /**
     * Blocked reasons per task, keyed by canonical id.
     */
    public Map<TaskId, Set<BlockedReason>> evaluate(TaskSet taskSet, Instant now) {
        Map<TaskId, Set<BlockedReason>> reasons = new TreeMap<>();

        for (Task task : taskSet.containmentOrder()) {
            Set<BlockedReason> taskReasons = evaluateTask(task, taskSet, now, reasons);
            reasons.put(task.id(), Collections.unmodifiableSet(taskReasons));
            log.trace("Task {} -> {}", task.id(), taskReasons);
        }

        return reasons;
    }

    /**
     * A task is a next action when nothing blocks it and it is not waiting.
     */
    public static boolean isNextAction(Task task, Set<BlockedReason> reasons) {
        return reasons.isEmpty() && task.status() != TaskStatus.WAITING;
    }

    private Set<BlockedReason> evaluateTask(
            Task task,
            TaskSet taskSet,
            Instant now,
            Map<TaskId, Set<BlockedReason>> evaluated
    ) {
        // Terminal tasks carry exactly one reason
        if (task.status() == TaskStatus.DONE) {
            return EnumSet.of(BlockedReason.COMPLETED);
        }
        if (task.status() == TaskStatus.CANCELED) {
            return EnumSet.of(BlockedReason.CANCELED);
        }

        Set<BlockedReason> reasons = EnumSet.noneOf(BlockedReason.class);

        if (task.startTime() != null && task.startTime().isAfter(now)) {
            reasons.add(BlockedReason.NOT_STARTED);
        }

        if (hasOpenDescendant(task, taskSet)) {
            reasons.add(BlockedReason.HAS_OPEN_CHILDREN);
        }

        checkDependencies(task, taskSet, now).ifPresent(reasons::add);

        Optional<Task> parent = taskSet.parentOf(task.id());
        if (parent.isPresent()) {
            Set<BlockedReason> parentReasons = evaluated.getOrDefault(parent.get().id(), Set.of());
            if (parentReasons.stream().anyMatch(BlockedReason::isDependencyFamily)) {
                reasons.add(BlockedReason.ANCESTOR_DEPENDENCY_UNMET);
            }
        }

        return reasons;
    }

    private boolean hasOpenDescendant(Task task, TaskSet taskSet) {
        return taskSet.descendantsOf(task.id()).stream()
                .anyMatch(descendant -> descendant.status().isOpen());
    }

    /**
     * Dependency gate: unmet, delayed, or open (empty).
     * Targets that are not tasks impose no constraint.
     */
    private Optional<BlockedReason> checkDependencies(Task task, TaskSet taskSet, Instant now) {
        List<Task> targets = taskSet.dependenciesOf(task.id());
        if (targets.isEmpty()) {
            return Optional.empty();
        }

        List<Task> done = targets.stream()
                .filter(target -> target.status() == TaskStatus.DONE)
                .toList();

        boolean satisfied = task.dependsMode() == DependencyMode.ALL
                ? done.size() == targets.size()
                : !done.isEmpty();
        if (!satisfied) {
            return Optional.of(BlockedReason.DEPENDENCY_UNMET);
        }

        if (!task.hasDependencyDelay()) {
            return Optional.empty();
        }

        Instant gate = gateInstant(task, done);
        if (now.isBefore(gate)) {
            log.trace("Task {} delayed until {}", task.id(), gate);
            return Optional.of(BlockedReason.DEPENDENCY_DELAYED);
        }
        return Optional.empty();
    }

    /**
     * Latest (ALL) or earliest (ANY) completion among the completed targets,
     * plus the delay. A target with no known completion instant counts as
     * completed at the epoch.
     */
    private Instant gateInstant(Task task, List<Task> done) {
        Comparator<Instant> order = Comparator.naturalOrder();
        Instant completedAt = done.stream()
                .map(target -> target.completionInstant().orElse(Instant.EPOCH))
                .reduce(task.dependsMode() == DependencyMode.ALL
                        ? BinaryOperator.maxBy(order)
                        : BinaryOperator.minBy(order))
                .orElse(Instant.EPOCH);

        Duration delay = Duration.ofMillis(Math.round(task.dependencyDelayHours() * MILLIS_PER_HOUR));
        // Saturate instead of overflowing past the largest instant
        if (completedAt.isAfter(Instant.MAX.minus(delay))) {
            return Instant.MAX;
        }
        return completedAt.plus(delay);
    }
}
