package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.planner.domain.ScoreContext;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives each task's {@link ScoreContext} from the dependency graph.
 *
 * A task that many open tasks wait on is more critical: transitive dependents
 * saturate at 5, direct dependents at 3.
 */
@ApplicationScoped
public class ScoreContextCalculator {

    static final double DESCENDANT_SATURATION = 5.0;
    static final double DEMAND_SATURATION = 3.0;

    public Map<TaskId, ScoreContext> calculate(TaskSet taskSet, Instant now) {
        Map<TaskId, ScoreContext> contexts = new TreeMap<>();
        for (Task task : taskSet.tasks()) {
            contexts.put(task.id(), contextOf(task, taskSet, now));
        }
        return contexts;
    }

    ScoreContext contextOf(Task task, TaskSet taskSet, Instant now) {
        long openTransitive = taskSet.transitiveDependentsOf(task.id()).stream()
                .filter(dependent -> dependent.status().isOpen())
                .count();
        long openDirect = taskSet.directDependentsOf(task.id()).stream()
                .filter(dependent -> dependent.status().isOpen())
                .count();

        return new ScoreContext(
                Math.min(1.0, openTransitive / DESCENDANT_SATURATION),
                Math.min(1.0, openDirect / DEMAND_SATURATION),
                waitingDays(task, now)
        );
    }

    private Double waitingDays(Task task, Instant now) {
        if (!task.status().isOpen() || task.startTime() == null || task.startTime().isAfter(now)) {
            return null;
        }
        return PriorityScorer.daysBetween(task.startTime(), now);
    }
}
