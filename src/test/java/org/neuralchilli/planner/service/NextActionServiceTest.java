package org.neuralchilli.planner.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.planner.EngineFixture;
import org.neuralchilli.planner.config.BlockSnapshotParser;
import org.neuralchilli.planner.domain.BlockedReason;
import org.neuralchilli.planner.domain.EvaluationStatistics;
import org.neuralchilli.planner.domain.NextActionEvaluation;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;

import java.io.InputStream;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.planner.BlockFixtures.*;

class NextActionServiceTest {

    private EngineFixture fixture;
    private NextActionService service;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new EngineFixture();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("snapshots/sample-blocks.yaml")) {
            assertThat(in).as("sample snapshot on the test classpath").isNotNull();
            fixture.store.replaceAll(new BlockSnapshotParser().parse(in));
        }
        service = fixture.nextActionService();
    }

    private static List<Long> ids(List<NextActionEvaluation> evaluations) {
        return evaluations.stream().map(evaluation -> evaluation.id().value()).toList();
    }

    @Test
    void shouldEvaluateEveryTaskInIdOrder() {
        List<NextActionEvaluation> evaluations = service.collectNextActionEvaluations(fixture.schema);

        // Mirror 70 collapses onto 11
        assertThat(ids(evaluations)).containsExactly(10L, 11L, 20L, 21L, 30L, 40L, 50L, 60L, 80L, 90L);
    }

    @Test
    void shouldRankNextActions() {
        List<NextActionEvaluation> nextActions = service.collectNextActionItems(fixture.schema);

        assertThat(ids(nextActions)).containsExactly(60L, 11L, 80L, 90L);
        assertThat(nextActions.get(0).text()).isEqualTo("Fix invoice bug");
        assertThat(nextActions.get(1).score()).isCloseTo(37.241, within(0.001));
        assertThat(nextActions.get(2).score()).isEqualTo(nextActions.get(1).score());
    }

    @Test
    void shouldReturnNextActionTasks() {
        List<Task> tasks = service.collectNextActions(fixture.schema);

        assertThat(tasks).extracting(Task::id).startsWith(TaskId.of(60));
        assertThat(tasks).hasSize(4);
    }

    @Test
    void shouldAssignExpectedReasons() {
        assertThat(reasons(10)).containsExactly(BlockedReason.HAS_OPEN_CHILDREN);
        assertThat(reasons(20)).containsExactlyInAnyOrder(
                BlockedReason.DEPENDENCY_UNMET, BlockedReason.HAS_OPEN_CHILDREN);
        assertThat(reasons(21)).containsExactly(BlockedReason.ANCESTOR_DEPENDENCY_UNMET);
        assertThat(reasons(30)).containsExactly(BlockedReason.COMPLETED);
        assertThat(reasons(40)).containsExactly(BlockedReason.NOT_STARTED);
        assertThat(reasons(50)).isEmpty();
        assertThat(service.findEvaluation(fixture.schema, 50).isNextAction()).isFalse();
    }

    private Set<BlockedReason> reasons(long id) {
        return service.findEvaluation(fixture.schema, id).blockedReason();
    }

    @Test
    void shouldRankOpenTasksOnly() {
        List<Long> ranked = ids(service.collectRankedTasks(fixture.schema));

        assertThat(ranked).hasSize(9).doesNotContain(30L);
        assertThat(ranked.get(0)).isEqualTo(60L);
    }

    @Test
    void shouldSummarizePass() {
        EvaluationStatistics statistics = service.statistics(fixture.schema);

        assertThat(statistics.totalTasks()).isEqualTo(10);
        assertThat(statistics.nextActions()).isEqualTo(4);
        assertThat(statistics.waitingTasks()).isEqualTo(1);
        assertThat(statistics.blockedTasks()).isEqualTo(5);
        assertThat(statistics.blockedBy(BlockedReason.HAS_OPEN_CHILDREN)).isEqualTo(1);
        assertThat(statistics.blockedBy(BlockedReason.DEPENDENCY_UNMET)).isEqualTo(1);
    }

    @Test
    void shouldResolveMirrorIdToSourceEvaluation() {
        NextActionEvaluation viaMirror = service.findEvaluation(fixture.schema, 70);

        assertThat(viaMirror.id()).isEqualTo(TaskId.of(11));
    }

    @Test
    void shouldThrowForBlockThatIsNotTask() {
        assertThatThrownBy(() -> service.findEvaluation(fixture.schema, 1))
                .isInstanceOf(TaskNotFoundException.class)
                .extracting(e -> ((TaskNotFoundException) e).blockId())
                .isEqualTo(1L);
    }

    @Test
    void shouldServeQueriesFromCachedPass() {
        service.collectNextActionEvaluations(fixture.schema);
        long generation = fixture.cache.peek().orElseThrow().generation();

        // A store change without invalidation is not seen
        fixture.store.put(task(95));
        service.collectNextActionItems(fixture.schema);

        assertThat(fixture.cache.peek().orElseThrow().generation()).isEqualTo(generation);
        assertThat(service.collectNextActionEvaluations(fixture.schema)).hasSize(10);
    }

    @Test
    void shouldRecomputeAfterInvalidation() {
        service.collectNextActionEvaluations(fixture.schema);
        fixture.store.put(task(95));

        service.invalidateNextActionEvaluationCache();

        assertThat(ids(service.collectNextActionEvaluations(fixture.schema))).contains(95L);
    }

    @Test
    void shouldEvaluateTaskWithFarFutureEndTime() {
        // Given - an end time at the top of the ISO year range
        fixture.store.put(task(1001, data("End time", "+999999999-01-01T00:00:00Z")));

        // When
        List<NextActionEvaluation> evaluations = service.collectNextActionEvaluations(fixture.schema);

        // Then - the task is scored and the rest of the pass is intact
        assertThat(ids(evaluations)).contains(1001L, 60L, 11L);
        assertThat(evaluation(evaluations, 1001).score()).isBetween(0.0, 100.0);
    }

    @Test
    void shouldEvaluateTaskWithEarliestEpochMillisStartTime() {
        // Given
        fixture.store.put(task(1001, data("Start time", Long.MIN_VALUE)));

        // When
        List<NextActionEvaluation> evaluations = service.collectNextActionEvaluations(fixture.schema);

        // Then - started long ago, so nothing keeps it back
        assertThat(evaluation(evaluations, 1001).blockedReason()).isEmpty();
        assertThat(evaluation(evaluations, 1001).score()).isBetween(0.0, 100.0);
        assertThat(ids(service.collectNextActionItems(fixture.schema))).contains(1001L, 60L);
    }

    @Test
    void shouldHoldDelayedDependentWhenGateRunsPastLastInstant() {
        // Given - a target completed at the end of time and a huge delay
        fixture.store.put(task(1001, data("Status", "Done", "Completed time", "+999999999-12-31T23:59:59Z")));
        fixture.store.put(task(1002, data("Depends on", List.of(1001L), "Dependency delay", 1.0e15)));

        // When
        List<NextActionEvaluation> evaluations = service.collectNextActionEvaluations(fixture.schema);

        // Then
        assertThat(evaluation(evaluations, 1002).blockedReason()).containsExactly(BlockedReason.DEPENDENCY_DELAYED);
    }

    private static NextActionEvaluation evaluation(List<NextActionEvaluation> evaluations, long id) {
        return evaluations.stream()
                .filter(evaluation -> evaluation.id().value() == id)
                .findFirst()
                .orElseThrow();
    }
}
