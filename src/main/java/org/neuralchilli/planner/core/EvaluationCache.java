package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Holds the most recent {@link EvaluationPass}.
 *
 * A held pass is returned as-is until {@link #invalidate()} is called or a
 * different tag alias is asked for. Nothing here watches the store: callers
 * that change blocks must invalidate.
 */
@ApplicationScoped
public class EvaluationCache {

    private static final Logger log = LoggerFactory.getLogger(EvaluationCache.class);

    private final EvaluationMonitor monitor;

    private EvaluationPass current;
    private long generation;

    @Inject
    public EvaluationCache(EvaluationMonitor monitor) {
        this.monitor = monitor;
    }

    /**
     * Return the held pass for this alias, or compute and hold a new one.
     *
     * @param tagAlias task tag the pass is for
     * @param compute  computes a pass for the given generation number
     */
    public synchronized EvaluationPass get(String tagAlias, LongFunction<EvaluationPass> compute) {
        if (current != null && current.tagAlias().equals(tagAlias)) {
            monitor.recordCacheHit();
            return current;
        }

        monitor.recordCacheMiss();
        if (current != null) {
            log.info("Tag alias changed from '{}' to '{}', recomputing", current.tagAlias(), tagAlias);
            generation++;
        }

        EvaluationPass pass = compute.apply(generation);
        log.info("Computed evaluation pass {} ({} tasks)", pass.generation(), pass.evaluations().size());
        current = pass;
        return pass;
    }

    /**
     * Drop the held pass. The next read recomputes.
     */
    public synchronized void invalidate() {
        generation++;
        monitor.recordInvalidation();
        if (current != null) {
            log.debug("Invalidated evaluation pass {}", current.generation());
        }
        current = null;
    }

    public synchronized Optional<EvaluationPass> peek() {
        return Optional.ofNullable(current);
    }

    public synchronized long generation() {
        return generation;
    }
}
