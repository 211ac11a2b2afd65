package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.BlockRef;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskPropertyValues;
import org.neuralchilli.planner.domain.TaskSchema;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;
import org.neuralchilli.planner.store.BlockStore;
import org.neuralchilli.planner.util.StringFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * Builds the {@link TaskSet} for one evaluation pass.
 *
 * Reads the tagged blocks once, collapses mirrors onto their canonical id,
 * decodes every task and derives containment and dependency links between
 * canonical ids.
 */
@ApplicationScoped
public class TaskGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphLoader.class);

    private final BlockStore blockStore;
    private final IdentityResolver identityResolver;
    private final TaskPropertyDecoder decoder;
    private final EvaluationMonitor monitor;

    @Inject
    public TaskGraphLoader(
            BlockStore blockStore,
            IdentityResolver identityResolver,
            TaskPropertyDecoder decoder,
            EvaluationMonitor monitor
    ) {
        this.blockStore = blockStore;
        this.identityResolver = identityResolver;
        this.decoder = decoder;
        this.monitor = monitor;
    }

    /**
     * Load every task carrying the schema's tag.
     */
    public TaskSet loadAllTasks(TaskSchema schema) {
        EvaluationMonitor.Timer timer = monitor.startTimer(EvaluationMonitor.LOAD);
        String alias = schema.tagAlias();

        List<Block> fetched = blockStore.fetchTaggedBlocks(alias);
        Map<Long, Block> workingSet = new LinkedHashMap<>();
        fetched.forEach(block -> workingSet.putIfAbsent(block.id(), block));
        IdentityResolver resolver = identityResolver.withWorkingSet(workingSet);

        // First pass: one entry per canonical id
        Map<TaskId, Source> sources = new TreeMap<>();
        for (Block block : fetched) {
            TaskId id = resolver.canonicalId(block.id());
            if (sources.containsKey(id)) {
                log.debug("Block {} collapses onto task {} which is already loaded", block.id(), id);
                continue;
            }

            Block live = liveBlock(id, block, workingSet);
            Optional<BlockRef> tagRef = live.tagRef(alias).or(() -> block.tagRef(alias));
            if (tagRef.isEmpty()) {
                log.trace("Block {} does not carry tag '{}', skipping", block.id(), alias);
                continue;
            }

            BlockProperty meta = live.property(TaskSchema.META_PROPERTY)
                    .or(() -> block.property(TaskSchema.META_PROPERTY))
                    .orElse(null);
            TaskPropertyValues values = decoder.decode(live.id(), tagRef.get(), meta, schema);
            sources.put(id, new Source(id, live, block, values));
        }

        // Second pass: links, now that every task id is known
        List<Task> tasks = new ArrayList<>(sources.size());
        for (Source source : sources.values()) {
            tasks.add(materialize(source, sources, resolver));
        }

        TaskSet taskSet = TaskSet.of(tasks);
        for (int i = 0; i < taskSet.skippedContainmentEdges(); i++) {
            monitor.recordSkippedContainmentEdge();
        }

        Duration elapsed = timer.stop();
        log.info("Loaded {} tasks for tag '{}' from {} blocks in {}ms",
                taskSet.size(), alias, fetched.size(), elapsed.toMillis());
        log.debug("{}", taskSet);

        return taskSet;
    }

    private Block liveBlock(TaskId id, Block fetched, Map<Long, Block> workingSet) {
        return blockStore.findBlock(id.value())
                .or(() -> Optional.ofNullable(workingSet.get(id.value())))
                .orElse(fetched);
    }

    private Task materialize(Source source, Map<TaskId, Source> sources, IdentityResolver resolver) {
        TaskId id = source.id();
        TaskPropertyValues values = source.values();

        TaskId parent = null;
        if (source.live().parent() != null) {
            TaskId candidate = resolver.canonicalId(source.live().parent());
            if (!candidate.equals(id) && sources.containsKey(candidate)) {
                parent = candidate;
            }
        }

        Set<TaskId> children = new LinkedHashSet<>();
        for (Long rawChild : source.live().children()) {
            TaskId child = resolver.canonicalId(rawChild);
            if (!child.equals(id) && sources.containsKey(child)) {
                children.add(child);
            }
        }

        Set<TaskId> dependsOn = new LinkedHashSet<>();
        for (Long raw : values.dependsOn()) {
            TaskId target = resolveDependency(raw, source, sources, resolver);
            if (target.equals(id)) {
                log.debug("Task {} depends on itself, dropping", id);
                continue;
            }
            if (!sources.containsKey(target)) {
                monitor.recordDanglingDependency();
                log.debug("Task {} depends on {} which is not a task", id, target);
            }
            dependsOn.add(target);
        }

        return Task.builder(id)
                .text(StringFunctions.displayText(source.live().text()))
                .status(values.status())
                .startTime(values.startTime())
                .endTime(values.endTime())
                .completedTime(values.completedTime())
                .importance(values.importance())
                .urgency(values.urgency())
                .effort(values.effort())
                .star(values.star())
                .dependsOn(new ArrayList<>(dependsOn))
                .dependsMode(values.dependsMode())
                .dependencyDelayHours(values.dependencyDelayHours())
                .parentTaskId(parent)
                .childTaskIds(new ArrayList<>(children))
                .build();
    }

    /**
     * A stored dependency value is either the id of a reference on the source
     * block (whose target is the dependency) or a block id.
     */
    private TaskId resolveDependency(
            long raw,
            Source source,
            Map<TaskId, Source> sources,
            IdentityResolver resolver
    ) {
        Optional<BlockRef> ref = source.live().ref(raw).or(() -> source.fetched().ref(raw));
        if (ref.isPresent()) {
            TaskId viaRef = resolver.canonicalId(ref.get().to());
            if (sources.containsKey(viaRef)) {
                return viaRef;
            }
        }
        return resolver.canonicalId(raw);
    }

    private record Source(TaskId id, Block live, Block fetched, TaskPropertyValues values) {
    }
}
