package org.neuralchilli.planner.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters and timings for the readiness engine.
 *
 * Tracks:
 * - evaluation cache hits, misses and invalidations
 * - tolerated data faults (decode fallbacks, dangling dependencies)
 * - pass timings per stage (load, evaluate, score)
 */
@ApplicationScoped
public class EvaluationMonitor {

    private static final Logger log = LoggerFactory.getLogger(EvaluationMonitor.class);

    public static final String LOAD = "load";
    public static final String EVALUATE = "evaluate";
    public static final String SCORE = "score";

    // Cache metrics
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder invalidations = new LongAdder();

    // Data fault metrics
    private final LongAdder decodeFallbacks = new LongAdder();
    private final LongAdder danglingDependencies = new LongAdder();
    private final LongAdder skippedContainmentEdges = new LongAdder();

    // Pass metrics
    private final LongAdder tasksEvaluated = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordInvalidation() {
        invalidations.increment();
    }

    /**
     * Get cache hit rate in percent.
     */
    public double getCacheHitRate() {
        long hits = cacheHits.sum();
        long total = hits + cacheMisses.sum();
        return total > 0 ? (hits * 100.0) / total : 0.0;
    }

    /**
     * Record a property value that could not be decoded and fell back to its default.
     */
    public void recordDecodeFallback() {
        decodeFallbacks.increment();
    }

    /**
     * Record a dependency target that no longer resolves to a task.
     */
    public void recordDanglingDependency() {
        danglingDependencies.increment();
    }

    /**
     * Record a containment edge dropped because it would close a cycle.
     */
    public void recordSkippedContainmentEdge() {
        skippedContainmentEdges.increment();
    }

    public void recordTasksEvaluated(int count) {
        tasksEvaluated.add(count);
    }

    public long getDecodeFallbacks() {
        return decodeFallbacks.sum();
    }

    public long getDanglingDependencies() {
        return danglingDependencies.sum();
    }

    public long getInvalidations() {
        return invalidations.sum();
    }

    /**
     * Start timing a pass stage.
     *
     * @param operation Stage name
     * @return Timer handle to stop timing
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    /**
     * Timer handle for stage timing.
     */
    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        /**
         * Stop timing and record duration.
         */
        public Duration stop() {
            Duration duration = Duration.between(start, Instant.now());
            recordTiming(operation, duration);
            return duration;
        }
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.compute(operation, (key, stats) -> {
            if (stats == null) {
                stats = new TimingStats();
            }
            stats.record(duration);
            return stats;
        });
    }

    /**
     * Get timing statistics for a stage.
     */
    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    /**
     * Statistics for stage timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    /**
     * Get a snapshot of all counters.
     */
    public MonitorReport getReport() {
        return new MonitorReport(
                getCacheHitRate(),
                cacheHits.sum(),
                cacheMisses.sum(),
                invalidations.sum(),
                tasksEvaluated.sum(),
                decodeFallbacks.sum(),
                danglingDependencies.sum(),
                skippedContainmentEdges.sum(),
                getTimingStats(LOAD).getAverage(),
                getTimingStats(EVALUATE).getAverage(),
                getTimingStats(SCORE).getAverage()
        );
    }

    /**
     * Monitor report snapshot.
     */
    public record MonitorReport(
            double cacheHitRate,
            long cacheHits,
            long cacheMisses,
            long invalidations,
            long tasksEvaluated,
            long decodeFallbacks,
            long danglingDependencies,
            long skippedContainmentEdges,
            Duration averageLoad,
            Duration averageEvaluate,
            Duration averageScore
    ) {
        @Override
        public String toString() {
            return String.format("""
                Evaluation Report:
                ==================
                Cache:
                  Hit Rate: %.1f%% (%d hits, %d misses, %d invalidations)

                Passes:
                  Tasks evaluated: %d
                  Avg load: %dms, evaluate: %dms, score: %dms

                Data faults:
                  Decode fallbacks: %d
                  Dangling dependencies: %d
                  Skipped containment edges: %d
                """,
                    cacheHitRate, cacheHits, cacheMisses, invalidations,
                    tasksEvaluated,
                    averageLoad.toMillis(), averageEvaluate.toMillis(), averageScore.toMillis(),
                    decodeFallbacks, danglingDependencies, skippedContainmentEdges
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        cacheHits.reset();
        cacheMisses.reset();
        invalidations.reset();
        decodeFallbacks.reset();
        danglingDependencies.reset();
        skippedContainmentEdges.reset();
        tasksEvaluated.reset();
        timingStats.clear();
        log.info("Evaluation metrics reset");
    }

    /**
     * Log current report.
     */
    public void logReport() {
        log.info("\n{}", getReport());
    }
}
