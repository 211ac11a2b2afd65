package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.planner.domain.ScoreContext;
import org.neuralchilli.planner.domain.Task;

import java.time.Instant;

/**
 * Continuous priority score in [0,100].
 *
 * A weighted base of importance, urgency, due date, start date and context is
 * boosted by criticality, lateness, start-by pressure and aging, then divided
 * by an effort penalty. Pure function of its inputs.
 */
@ApplicationScoped
public class PriorityScorer {

    public static final double NEUTRAL = 50.0;
    public static final double WAITING_MULTIPLIER = 0.6;

    static final double IMPORTANCE_EXPONENT = 1.25;
    static final double URGENCY_EXPONENT = 1.15;

    static final double W_IMPORTANCE = 0.40;
    static final double W_URGENCY = 0.22;
    static final double W_DUE = 0.20;
    static final double W_START = 0.10;
    static final double W_CONTEXT = 0.08;

    static final double CRITICALITY_BOOST = 0.30;
    static final double DEADLINE_BOOST = 0.25;
    static final double START_BY_BOOST = 0.22;
    static final double AGING_BOOST = 0.12;
    static final double EFFORT_PENALTY = 0.90;

    static final double NO_DUE_FACTOR = 45.0;
    static final double DUE_DECAY_DAYS = 4.0;
    static final double START_HORIZON_DAYS = 14.0;
    static final double OVERDUE_SATURATION_DAYS = 7.0;
    static final double AGING_SATURATION_DAYS = 14.0;

    // Effort 100 means a 24-hour job, worked at 3 focused hours a day
    static final double MAX_EFFORT_HOURS = 24.0;
    static final double FOCUS_HOURS_PER_DAY = 3.0;
    static final double SLACK_WINDOW_DAYS = 7.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    public double score(Task task, Instant now, ScoreContext context) {
        return score(task, now, context, 1.0);
    }

    /**
     * Score with a status multiplier applied before clamping, e.g.
     * {@link #WAITING_MULTIPLIER} for waiting tasks.
     */
    public double score(Task task, Instant now, ScoreContext context, double statusMultiplier) {
        ScoreContext ctx = context == null ? ScoreContext.empty() : context;

        double importance = curve(neutral(task.importance()), IMPORTANCE_EXPONENT);
        double urgency = curve(neutral(task.urgency()), URGENCY_EXPONENT);
        double effortNormalized = neutral(task.effort()) / 100.0;

        Double daysUntilDue = task.endTime() == null ? null : daysBetween(now, task.endTime());

        double base = W_IMPORTANCE * importance
                + W_URGENCY * urgency
                + W_DUE * dueFactor(task.endTime(), now, daysUntilDue)
                + W_START * startFactor(task.startTime(), now)
                + W_CONTEXT * (task.star() ? 80.0 : 50.0);

        double criticality = clamp01(0.6 * orZero(ctx.dependencyDescendants())
                + 0.4 * orZero(ctx.dependencyDemand()));
        double overdue = daysUntilDue == null
                ? 0.0
                : clamp01(Math.max(0.0, -daysUntilDue) / OVERDUE_SATURATION_DAYS);
        double startBy = startByPressure(daysUntilDue, effortNormalized);
        double aging = clamp01(orZero(ctx.waitingDays()) / AGING_SATURATION_DAYS);

        double raw = base
                * (1 + CRITICALITY_BOOST * criticality)
                * (1 + DEADLINE_BOOST * overdue)
                * (1 + START_BY_BOOST * startBy)
                * (1 + AGING_BOOST * aging)
                * statusMultiplier
                / (1 + EFFORT_PENALTY * effortNormalized);

        return round3(Math.max(0.0, Math.min(100.0, raw)));
    }

    /**
     * Push values away from the neutral midpoint: 50 + sign(c) * (|c|/50)^p * 50
     */
    static double curve(double value, double exponent) {
        double c = Math.max(0.0, Math.min(100.0, value)) - NEUTRAL;
        return NEUTRAL + Math.signum(c) * Math.pow(Math.abs(c) / NEUTRAL, exponent) * NEUTRAL;
    }

    static double dueFactor(Instant endTime, Instant now, Double daysUntilDue) {
        if (endTime == null) {
            return NO_DUE_FACTOR;
        }
        if (!endTime.isAfter(now)) {
            return 100.0;
        }
        return 35.0 + 65.0 * Math.exp(-daysUntilDue / DUE_DECAY_DAYS);
    }

    static double startFactor(Instant startTime, Instant now) {
        if (startTime == null || !startTime.isAfter(now)) {
            return 100.0;
        }
        double t = clamp01(daysBetween(now, startTime) / START_HORIZON_DAYS);
        return 10.0 + 90.0 * (1 - t) * (1 - t);
    }

    static double startByPressure(Double daysUntilDue, double effortNormalized) {
        if (daysUntilDue == null) {
            return 0.0;
        }
        double requiredDays = effortNormalized * MAX_EFFORT_HOURS / FOCUS_HOURS_PER_DAY;
        double slack = daysUntilDue - requiredDays - 1;
        return clamp01(1 - slack / SLACK_WINDOW_DAYS);
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    /**
     * Fractional days from {@code from} to {@code to}, finite for any pair of instants
     */
    static double daysBetween(Instant from, Instant to) {
        double seconds = (double) (to.getEpochSecond() - from.getEpochSecond())
                + (to.getNano() - from.getNano()) / 1_000_000_000.0;
        return seconds / SECONDS_PER_DAY;
    }

    private static double neutral(Double value) {
        return value == null ? NEUTRAL : value;
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
