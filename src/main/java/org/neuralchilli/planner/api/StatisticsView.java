package org.neuralchilli.planner.api;

import org.neuralchilli.planner.domain.BlockedReason;
import org.neuralchilli.planner.domain.EvaluationStatistics;

import java.util.LinkedHashMap;
import java.util.Map;

public record StatisticsView(
        int totalTasks,
        int nextActions,
        int waitingTasks,
        int blockedTasks,
        Map<String, Integer> primaryReasons
) {
    public static StatisticsView from(EvaluationStatistics statistics) {
        Map<String, Integer> reasons = new LinkedHashMap<>();
        for (BlockedReason reason : BlockedReason.values()) {
            int count = statistics.blockedBy(reason);
            if (count > 0) {
                reasons.put(reason.tag(), count);
            }
        }
        return new StatisticsView(
                statistics.totalTasks(),
                statistics.nextActions(),
                statistics.waitingTasks(),
                statistics.blockedTasks(),
                reasons
        );
    }
}
