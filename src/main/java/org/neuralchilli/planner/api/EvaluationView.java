package org.neuralchilli.planner.api;

import org.neuralchilli.planner.domain.BlockedReason;
import org.neuralchilli.planner.domain.NextActionEvaluation;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;

import java.time.Instant;
import java.util.List;

/**
 * JSON shape of one task evaluation.
 */
public record EvaluationView(
        long id,
        String text,
        String status,
        boolean nextAction,
        List<String> blockedReasons,
        String primaryReason,
        double score,
        Instant startTime,
        Instant endTime,
        boolean star,
        Long parentId,
        List<Long> dependsOn,
        String dependsMode
) {
    public static EvaluationView from(NextActionEvaluation evaluation) {
        Task task = evaluation.task();
        return new EvaluationView(
                task.id().value(),
                task.text(),
                task.status().name(),
                evaluation.isNextAction(),
                evaluation.blockedReason().stream().map(BlockedReason::tag).toList(),
                evaluation.primaryReason().map(BlockedReason::tag).orElse(null),
                evaluation.score(),
                task.startTime(),
                task.endTime(),
                task.star(),
                task.parent().map(TaskId::value).orElse(null),
                task.dependsOn().stream().map(TaskId::value).toList(),
                task.dependsMode().name()
        );
    }

    public static List<EvaluationView> from(List<NextActionEvaluation> evaluations) {
        return evaluations.stream().map(EvaluationView::from).toList();
    }
}
