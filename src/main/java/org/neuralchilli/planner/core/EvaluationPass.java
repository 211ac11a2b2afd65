package org.neuralchilli.planner.core;

import org.neuralchilli.planner.domain.BlockedReason;
import org.neuralchilli.planner.domain.EvaluationStatistics;
import org.neuralchilli.planner.domain.NextActionEvaluation;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskStatus;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.*;

/**
 * Result of one full evaluation: every task's readiness and score, computed
 * against one snapshot at one instant.
 */
public record EvaluationPass(
        long generation,
        Instant evaluatedAt,
        String tagAlias,
        List<NextActionEvaluation> evaluations,
        Map<TaskId, NextActionEvaluation> byId
) {
    /**
     * Score descending, then canonical id ascending.
     */
    public static final Comparator<NextActionEvaluation> RANKING =
            Comparator.comparingDouble(NextActionEvaluation::score).reversed()
                    .thenComparing(NextActionEvaluation::id);

    public EvaluationPass {
        if (evaluatedAt == null) {
            throw new IllegalArgumentException("Evaluation instant cannot be null");
        }
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
        byId = byId == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byId));
    }

    public static EvaluationPass of(
            long generation,
            Instant evaluatedAt,
            String tagAlias,
            List<NextActionEvaluation> evaluations
    ) {
        List<NextActionEvaluation> ordered = new ArrayList<>(evaluations);
        ordered.sort(Comparator.comparing(NextActionEvaluation::id));

        Map<TaskId, NextActionEvaluation> index = new TreeMap<>();
        ordered.forEach(evaluation -> index.put(evaluation.id(), evaluation));

        return new EvaluationPass(generation, evaluatedAt, tagAlias, ordered, index);
    }

    public Optional<NextActionEvaluation> find(TaskId id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Actionable evaluations in ranking order.
     */
    public List<NextActionEvaluation> nextActions() {
        return evaluations.stream()
                .filter(NextActionEvaluation::isNextAction)
                .sorted(RANKING)
                .toList();
    }

    /**
     * Every open task in ranking order, blocked or not.
     */
    public List<NextActionEvaluation> ranked() {
        return evaluations.stream()
                .filter(evaluation -> evaluation.task().status().isOpen())
                .sorted(RANKING)
                .toList();
    }

    public EvaluationStatistics statistics() {
        Map<BlockedReason, Integer> primaryReasons = new EnumMap<>(BlockedReason.class);
        int nextActions = 0;
        int waiting = 0;

        for (NextActionEvaluation evaluation : evaluations) {
            if (evaluation.isNextAction()) {
                nextActions++;
            }
            if (evaluation.task().status() == TaskStatus.WAITING) {
                waiting++;
            }
            evaluation.primaryReason().ifPresent(reason -> primaryReasons.merge(reason, 1, Integer::sum));
        }

        return new EvaluationStatistics(evaluations.size(), nextActions, waiting, primaryReasons);
    }

    @Nonnull
    @Override
    public String toString() {
        return "EvaluationPass[generation=" + generation +
                ", tag=" + tagAlias +
                ", tasks=" + evaluations.size() +
                ", evaluatedAt=" + evaluatedAt + "]";
    }
}
