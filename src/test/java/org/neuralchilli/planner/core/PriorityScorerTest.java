package org.neuralchilli.planner.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.planner.domain.ScoreContext;
import org.neuralchilli.planner.domain.Task;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class PriorityScorerTest {

    private static final Instant NOW = Instant.parse("2024-06-03T09:00:00Z");

    private final PriorityScorer scorer = new PriorityScorer();

    @Test
    void shouldScoreNeutralTask() {
        // Given: Every priority field neutral, no dates, no context
        Task task = Task.builder(1)
                .importance(50.0)
                .urgency(50.0)
                .effort(50.0)
                .build();

        // When/Then: 54 / 1.45
        assertThat(scorer.score(task, NOW, ScoreContext.empty())).isEqualTo(37.241);
    }

    @Test
    void shouldTreatMissingFieldsAsNeutral() {
        Task task = Task.builder(1).build();

        assertThat(scorer.score(task, NOW, null)).isEqualTo(37.241);
    }

    @Test
    void shouldBoostOverdueTask() {
        // Given: Due ten days ago, everything else neutral
        Task task = Task.builder(1)
                .endTime(NOW.minus(Duration.ofDays(10)))
                .build();

        // When/Then: 65 * 1.25 * 1.22 / 1.45
        assertThat(scorer.score(task, NOW, ScoreContext.empty())).isEqualTo(68.362);
    }

    @Test
    void shouldStayWithinBounds() {
        Task top = Task.builder(1)
                .importance(100.0)
                .urgency(100.0)
                .effort(0.0)
                .star(true)
                .endTime(NOW.minus(Duration.ofDays(30)))
                .build();
        Task bottom = Task.builder(2)
                .importance(0.0)
                .urgency(0.0)
                .effort(100.0)
                .startTime(NOW.plus(Duration.ofDays(60)))
                .build();
        ScoreContext critical = new ScoreContext(1.0, 1.0, 100.0);

        assertThat(scorer.score(top, NOW, critical)).isEqualTo(100.0);
        assertThat(scorer.score(bottom, NOW, ScoreContext.empty())).isBetween(0.0, 100.0);
    }

    @Test
    void shouldClampOutOfRangeInputs() {
        Task wild = Task.builder(1).importance(250.0).urgency(-40.0).build();
        Task clamped = Task.builder(1).importance(100.0).urgency(0.0).build();

        assertThat(scorer.score(wild, NOW, ScoreContext.empty()))
                .isEqualTo(scorer.score(clamped, NOW, ScoreContext.empty()));
    }

    @Test
    void shouldBeDeterministic() {
        Task task = Task.builder(1)
                .importance(73.0)
                .urgency(12.5)
                .effort(30.0)
                .startTime(NOW.plus(Duration.ofDays(3)))
                .endTime(NOW.plus(Duration.ofDays(9)))
                .build();
        ScoreContext context = new ScoreContext(0.4, 0.66, 2.0);

        double first = scorer.score(task, NOW, context);
        for (int i = 0; i < 10; i++) {
            assertThat(scorer.score(task, NOW, context)).isEqualTo(first);
        }
    }

    @Test
    void shouldRankHigherImportanceFirst() {
        Task important = Task.builder(1).importance(90.0).build();
        Task minor = Task.builder(2).importance(10.0).build();

        assertThat(scorer.score(important, NOW, ScoreContext.empty()))
                .isGreaterThan(scorer.score(minor, NOW, ScoreContext.empty()));
    }

    @Test
    void shouldApplyWaitingMultiplierBeforeRounding() {
        Task task = Task.builder(1).build();

        double waiting = scorer.score(task, NOW, ScoreContext.empty(), PriorityScorer.WAITING_MULTIPLIER);

        // 54 * 0.6 / 1.45
        assertThat(waiting).isEqualTo(22.345);
    }

    @Test
    void shouldRaiseScoreWithCriticality() {
        Task task = Task.builder(1).build();

        double plain = scorer.score(task, NOW, ScoreContext.empty());
        double critical = scorer.score(task, NOW, new ScoreContext(1.0, 1.0, null));

        // 54 * 1.3 / 1.45
        assertThat(critical).isEqualTo(48.414);
        assertThat(critical).isGreaterThan(plain);
    }

    @Test
    void shouldPreferSoonerDeadlines() {
        Task soon = Task.builder(1).endTime(NOW.plus(Duration.ofDays(1))).build();
        Task later = Task.builder(2).endTime(NOW.plus(Duration.ofDays(30))).build();

        assertThat(scorer.score(soon, NOW, ScoreContext.empty()))
                .isGreaterThan(scorer.score(later, NOW, ScoreContext.empty()));
    }

    @Test
    void shouldComputeStartFactorOverHorizon() {
        assertThat(PriorityScorer.startFactor(null, NOW)).isEqualTo(100.0);
        assertThat(PriorityScorer.startFactor(NOW.minus(Duration.ofDays(1)), NOW)).isEqualTo(100.0);
        assertThat(PriorityScorer.startFactor(NOW.plus(Duration.ofDays(7)), NOW)).isCloseTo(32.5, within(1e-9));
        assertThat(PriorityScorer.startFactor(NOW.plus(Duration.ofDays(40)), NOW)).isEqualTo(10.0);
    }

    @Test
    void shouldComputeDueFactor() {
        assertThat(PriorityScorer.dueFactor(null, NOW, null)).isEqualTo(45.0);
        assertThat(PriorityScorer.dueFactor(NOW, NOW, 0.0)).isEqualTo(100.0);
        assertThat(PriorityScorer.dueFactor(NOW.plus(Duration.ofDays(4)), NOW, 4.0))
                .isCloseTo(35.0 + 65.0 * Math.exp(-1), within(1e-9));
    }

    @Test
    void shouldComputeStartByPressure() {
        // No deadline, no pressure
        assertThat(PriorityScorer.startByPressure(null, 0.5)).isZero();
        // Effort 50 needs 4 days; 12 days out leaves 7 days of slack
        assertThat(PriorityScorer.startByPressure(12.0, 0.5)).isZero();
        // 8.5 days out leaves 3.5 days of slack
        assertThat(PriorityScorer.startByPressure(8.5, 0.5)).isCloseTo(0.5, within(1e-9));
        assertThat(PriorityScorer.startByPressure(-3.0, 0.5)).isEqualTo(1.0);
    }

    @Test
    void shouldCurveAwayFromNeutral() {
        assertThat(PriorityScorer.curve(50.0, 1.25)).isEqualTo(50.0);
        assertThat(PriorityScorer.curve(100.0, 1.25)).isEqualTo(100.0);
        assertThat(PriorityScorer.curve(0.0, 1.25)).isEqualTo(0.0);
        assertThat(PriorityScorer.curve(75.0, 1.25)).isCloseTo(50 + Math.pow(0.5, 1.25) * 50, within(1e-9));
    }

    @Test
    void shouldRoundToThreeDecimals() {
        assertThat(PriorityScorer.round3(12.34567)).isEqualTo(12.346);
        assertThat(PriorityScorer.round3(12.3444)).isEqualTo(12.344);
        assertThat(PriorityScorer.round3(37.24137931)).isEqualTo(37.241);
    }

    @Test
    void shouldMeasureDaysAcrossWholeInstantRange() {
        assertThat(PriorityScorer.daysBetween(NOW, NOW.plus(Duration.ofHours(36)))).isCloseTo(1.5, within(1e-9));
        assertThat(PriorityScorer.daysBetween(NOW, NOW.minusMillis(43_200_000L))).isCloseTo(-0.5, within(1e-9));

        // Far beyond the range of a millisecond duration
        assertThat(PriorityScorer.daysBetween(Instant.MIN, Instant.MAX)).isFinite().isPositive();
        assertThat(PriorityScorer.daysBetween(Instant.ofEpochMilli(Long.MIN_VALUE), NOW)).isFinite().isPositive();
    }

    @Test
    void shouldScoreTaskDueAtLastRepresentableInstant() {
        Task farOff = Task.builder(1).endTime(Instant.MAX).startTime(Instant.MIN).build();

        assertThat(scorer.score(farOff, NOW, ScoreContext.empty())).isBetween(0.0, 100.0);
    }
}
