package org.neuralchilli.planner.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongFunction;

import static org.assertj.core.api.Assertions.*;

class EvaluationCacheTest {

    private static final Instant NOW = Instant.parse("2024-06-03T09:00:00Z");

    private EvaluationMonitor monitor;
    private EvaluationCache cache;
    private AtomicInteger computations;

    @BeforeEach
    void setUp() {
        monitor = new EvaluationMonitor();
        cache = new EvaluationCache(monitor);
        computations = new AtomicInteger();
    }

    private LongFunction<EvaluationPass> compute(String alias) {
        return generation -> {
            computations.incrementAndGet();
            return EvaluationPass.of(generation, NOW, alias, List.of());
        };
    }

    @Test
    void shouldComputeOnFirstRead() {
        EvaluationPass pass = cache.get("Task", compute("Task"));

        assertThat(pass.generation()).isZero();
        assertThat(computations).hasValue(1);
        assertThat(cache.peek()).contains(pass);
    }

    @Test
    void shouldReturnSamePassUntilInvalidated() {
        EvaluationPass first = cache.get("Task", compute("Task"));
        EvaluationPass second = cache.get("Task", compute("Task"));

        assertThat(second).isSameAs(first);
        assertThat(computations).hasValue(1);
        assertThat(monitor.getCacheHitRate()).isEqualTo(50.0);
    }

    @Test
    void shouldRecomputeWithNewGenerationAfterInvalidate() {
        EvaluationPass first = cache.get("Task", compute("Task"));

        cache.invalidate();
        EvaluationPass second = cache.get("Task", compute("Task"));

        assertThat(cache.peek()).contains(second);
        assertThat(second).isNotSameAs(first);
        assertThat(second.generation()).isGreaterThan(first.generation());
        assertThat(computations).hasValue(2);
        assertThat(monitor.getInvalidations()).isEqualTo(1);
    }

    @Test
    void shouldEmptyCacheOnInvalidate() {
        cache.get("Task", compute("Task"));

        cache.invalidate();

        assertThat(cache.peek()).isEmpty();
    }

    @Test
    void shouldRecomputeWhenAliasChanges() {
        EvaluationPass tasks = cache.get("Task", compute("Task"));
        EvaluationPass todos = cache.get("Todo", compute("Todo"));

        assertThat(todos.tagAlias()).isEqualTo("Todo");
        assertThat(todos.generation()).isGreaterThan(tasks.generation());
        assertThat(computations).hasValue(2);
    }

    @Test
    void shouldNeverReuseGenerationNumbers() {
        long before = cache.generation();

        cache.invalidate();
        cache.invalidate();

        assertThat(cache.generation()).isEqualTo(before + 2);
        assertThat(cache.get("Task", compute("Task")).generation()).isEqualTo(before + 2);
    }
}
