package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.domain.BlockedReason;
import org.neuralchilli.planner.domain.NextActionEvaluation;
import org.neuralchilli.planner.domain.ScoreContext;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskSchema;
import org.neuralchilli.planner.domain.TaskStatus;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one uncached evaluation pass: load, readiness, context, score.
 */
@ApplicationScoped
public class NextActionEngine {

    private static final Logger log = LoggerFactory.getLogger(NextActionEngine.class);

    private final TaskGraphLoader loader;
    private final ReadinessEvaluator readinessEvaluator;
    private final ScoreContextCalculator contextCalculator;
    private final PriorityScorer scorer;
    private final EvaluationMonitor monitor;

    @Inject
    public NextActionEngine(
            TaskGraphLoader loader,
            ReadinessEvaluator readinessEvaluator,
            ScoreContextCalculator contextCalculator,
            PriorityScorer scorer,
            EvaluationMonitor monitor
    ) {
        this.loader = loader;
        this.readinessEvaluator = readinessEvaluator;
        this.contextCalculator = contextCalculator;
        this.scorer = scorer;
        this.monitor = monitor;
    }

    public EvaluationPass evaluate(TaskSchema schema, Instant now, long generation) {
        TaskSet taskSet = loader.loadAllTasks(schema);
        return evaluate(taskSet, schema.tagAlias(), now, generation);
    }

    /**
     * Evaluate an already loaded task set.
     */
    public EvaluationPass evaluate(TaskSet taskSet, String tagAlias, Instant now, long generation) {
        EvaluationMonitor.Timer evaluateTimer = monitor.startTimer(EvaluationMonitor.EVALUATE);
        Map<TaskId, Set<BlockedReason>> reasons = readinessEvaluator.evaluate(taskSet, now);
        Map<TaskId, ScoreContext> contexts = contextCalculator.calculate(taskSet, now);
        evaluateTimer.stop();

        EvaluationMonitor.Timer scoreTimer = monitor.startTimer(EvaluationMonitor.SCORE);
        List<NextActionEvaluation> evaluations = new ArrayList<>(taskSet.size());
        for (Task task : taskSet.tasks()) {
            Set<BlockedReason> taskReasons = reasons.getOrDefault(task.id(), Set.of());
            double multiplier = task.status() == TaskStatus.WAITING ? PriorityScorer.WAITING_MULTIPLIER : 1.0;
            double score = scorer.score(task, now, contexts.get(task.id()), multiplier);

            evaluations.add(new NextActionEvaluation(
                    task,
                    ReadinessEvaluator.isNextAction(task, taskReasons),
                    taskReasons,
                    score
            ));
        }
        scoreTimer.stop();

        monitor.recordTasksEvaluated(evaluations.size());
        EvaluationPass pass = EvaluationPass.of(generation, now, tagAlias, evaluations);
        log.debug("Evaluated {}: {}", pass, pass.statistics());
        return pass;
    }
}
