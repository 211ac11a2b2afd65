package org.neuralchilli.planner.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.core.EvaluationCache;
import org.neuralchilli.planner.core.EvaluationPass;
import org.neuralchilli.planner.core.IdentityResolver;
import org.neuralchilli.planner.core.NextActionEngine;
import org.neuralchilli.planner.domain.EvaluationStatistics;
import org.neuralchilli.planner.domain.NextActionEvaluation;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Read side of the planner: next actions, rankings and per-task evaluations.
 *
 * Every query is answered from the cached {@link EvaluationPass}; the first
 * query after an invalidation recomputes it.
 */
@ApplicationScoped
public class NextActionService {

    private static final Logger log = LoggerFactory.getLogger(NextActionService.class);

    private final NextActionEngine engine;
    private final EvaluationCache cache;
    private final IdentityResolver identityResolver;
    private final Clock clock;

    @Inject
    public NextActionService(
            NextActionEngine engine,
            EvaluationCache cache,
            IdentityResolver identityResolver,
            Clock clock
    ) {
        this.engine = engine;
        this.cache = cache;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    /**
     * The current pass for the schema's tag, computing it if needed.
     */
    public EvaluationPass currentPass(TaskSchema schema) {
        return cache.get(schema.tagAlias(),
                generation -> engine.evaluate(schema, clock.instant(), generation));
    }

    /**
     * Every task with its readiness and score, in canonical-id order.
     */
    public List<NextActionEvaluation> collectNextActionEvaluations(TaskSchema schema) {
        return currentPass(schema).evaluations();
    }

    /**
     * Actionable tasks, highest score first.
     */
    public List<Task> collectNextActions(TaskSchema schema) {
        return collectNextActionItems(schema).stream()
                .map(NextActionEvaluation::task)
                .toList();
    }

    /**
     * Actionable evaluations, highest score first.
     */
    public List<NextActionEvaluation> collectNextActionItems(TaskSchema schema) {
        return currentPass(schema).nextActions();
    }

    /**
     * Every open task, blocked or not, highest score first.
     */
    public List<NextActionEvaluation> collectRankedTasks(TaskSchema schema) {
        return currentPass(schema).ranked();
    }

    public EvaluationStatistics statistics(TaskSchema schema) {
        return currentPass(schema).statistics();
    }

    /**
     * Evaluation of the task behind a block id; mirror ids resolve to their source.
     *
     * @throws TaskNotFoundException if the block is not a task
     */
    public NextActionEvaluation findEvaluation(TaskSchema schema, long blockId) {
        TaskId id = identityResolver.canonicalId(blockId);
        return currentPass(schema).find(id)
                .orElseThrow(() -> new TaskNotFoundException(blockId));
    }

    public void invalidateNextActionEvaluationCache() {
        log.debug("Evaluation cache invalidated on request");
        cache.invalidate();
    }
}
