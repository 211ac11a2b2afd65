package org.neuralchilli.planner.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.core.EvaluationCache;
import org.neuralchilli.planner.core.IdentityResolver;
import org.neuralchilli.planner.core.TaskPropertyDecoder;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.BlockRef;
import org.neuralchilli.planner.domain.DependencyMode;
import org.neuralchilli.planner.domain.MovePosition;
import org.neuralchilli.planner.domain.PropertyType;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.domain.TaskPropertyValues;
import org.neuralchilli.planner.domain.TaskSchema;
import org.neuralchilli.planner.domain.TaskStatus;
import org.neuralchilli.planner.store.BlockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Write side of the planner.
 *
 * Every command resolves the block to its canonical task, writes through the
 * {@link BlockStore} and invalidates the evaluation cache before returning.
 */
@ApplicationScoped
public class TaskMutationService {

    private static final Logger log = LoggerFactory.getLogger(TaskMutationService.class);

    // Times are stored as epoch milliseconds
    private static final Instant EARLIEST_STORED = Instant.ofEpochMilli(Long.MIN_VALUE);
    private static final Instant LATEST_STORED = Instant.ofEpochMilli(Long.MAX_VALUE);

    private final BlockStore blockStore;
    private final IdentityResolver identityResolver;
    private final TaskPropertyDecoder decoder;
    private final EvaluationCache cache;
    private final ObjectMapper objectMapper;
    private final TaskSchema schema;
    private final Clock clock;

    @Inject
    public TaskMutationService(
            BlockStore blockStore,
            IdentityResolver identityResolver,
            TaskPropertyDecoder decoder,
            EvaluationCache cache,
            ObjectMapper objectMapper,
            TaskSchema schema,
            Clock clock
    ) {
        this.blockStore = blockStore;
        this.identityResolver = identityResolver;
        this.decoder = decoder;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.schema = schema;
        this.clock = clock;
    }

    /**
     * Advance todo -> doing -> done -> todo. Waiting and canceled tasks go to todo.
     *
     * @return the new status
     */
    public TaskStatus cycleStatus(long blockId) {
        return mutate("cycle status", blockId, task -> {
            TaskStatus next = task.values().status().nextInMainCycle();
            writeStatus(task, next);
            return next;
        });
    }

    public TaskStatus setStatus(long blockId, TaskStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        return mutate("set status", blockId, task -> {
            writeStatus(task, status);
            return status;
        });
    }

    public TaskStatus complete(long blockId) {
        return setStatus(blockId, TaskStatus.DONE);
    }

    public TaskId setStar(long blockId, boolean star) {
        return mutate("set star", blockId, task -> {
            writeTagData(task, List.of(
                    BlockProperty.of(names().star(), PropertyType.BOOLEAN, star ? Boolean.TRUE : null)
            ));
            return task.id();
        });
    }

    /**
     * Replace the task's dependencies. Ids are canonicalized; the task itself
     * and duplicates are dropped. An empty list also clears the delay.
     *
     * @return the stored dependency ids
     */
    public List<TaskId> setDependencies(
            long blockId,
            List<Long> dependsOn,
            DependencyMode mode,
            Double delayHours
    ) {
        if (delayHours != null && (delayHours < 0 || !Double.isFinite(delayHours))) {
            throw new IllegalArgumentException(
                    "Dependency delay must be a non-negative number of hours, got: " + delayHours
            );
        }

        return mutate("set dependencies", blockId, task -> {
            Set<TaskId> targets = new LinkedHashSet<>();
            for (Long raw : dependsOn == null ? List.<Long>of() : dependsOn) {
                if (raw == null) {
                    continue;
                }
                TaskId target = identityResolver.canonicalId(raw);
                if (!target.equals(task.id())) {
                    targets.add(target);
                }
            }

            List<Long> stored = targets.stream().map(TaskId::value).toList();
            Double delay = stored.isEmpty() ? null : delayHours;
            DependencyMode effectiveMode = mode == null ? DependencyMode.ALL : mode;

            writeTagData(task, List.of(
                    BlockProperty.of(names().dependsOn(), PropertyType.BLOCK_REFS, stored.isEmpty() ? null : stored),
                    BlockProperty.of(names().dependsMode(), PropertyType.TEXT_CHOICES, effectiveMode.name()),
                    BlockProperty.of(names().dependencyDelay(), PropertyType.NUMBER, delay)
            ));
            return List.copyOf(targets);
        });
    }

    /**
     * Set or clear (null) the start and end times.
     */
    public TaskId setSchedule(long blockId, Instant startTime, Instant endTime) {
        if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("End time " + endTime + " is before start time " + startTime);
        }
        requireEpochMillis("Start time", startTime);
        requireEpochMillis("End time", endTime);
        return mutate("set schedule", blockId, task -> {
            writeTagData(task, List.of(
                    timeProperty(names().startTime(), startTime),
                    timeProperty(names().endTime(), endTime)
            ));
            return task.id();
        });
    }

    /**
     * Write importance, urgency and effort into the priority meta. Values are
     * clamped to [0,100]; null clears a field. Other meta content is kept.
     */
    public TaskId setPriority(long blockId, Double importance, Double urgency, Double effort) {
        return mutate("set priority", blockId, task -> {
            ObjectNode meta = readMeta(task.block());
            JsonNode existing = meta.get("priority");
            ObjectNode priority = existing != null && existing.isObject()
                    ? (ObjectNode) existing
                    : meta.putObject("priority");
            putScore(priority, "importance", importance);
            putScore(priority, "urgency", urgency);
            putScore(priority, "effort", effort);

            blockStore.setBlockProperty(task.id().value(),
                    BlockProperty.of(TaskSchema.META_PROPERTY, PropertyType.JSON, writeMeta(meta)));
            return task.id();
        });
    }

    /**
     * Remove the task tag and the priority meta from the block.
     */
    public TaskId removeTask(long blockId) {
        return mutate("remove task", blockId, task -> {
            blockStore.removeTag(task.id().value(), schema.tagAlias());
            blockStore.setBlockProperty(task.id().value(),
                    BlockProperty.of(TaskSchema.META_PROPERTY, PropertyType.JSON, null));
            return task.id();
        });
    }

    /**
     * Create a new todo task as the last child of the given block. The parent
     * may be any block; a mirror resolves to its source.
     *
     * @return id of the created task
     */
    public TaskId addSubtask(long parentBlockId, String text) {
        return mutateBlock("add subtask", parentBlockId, parent -> {
            Block created = blockStore.insertChild(parent.id(), text == null ? "" : text.trim());
            blockStore.setTagData(created.id(), schema.tagAlias(), List.of(
                    BlockProperty.of(names().status(), PropertyType.TEXT_CHOICES, schema.labelOf(TaskStatus.TODO)),
                    BlockProperty.of(names().dependsMode(), PropertyType.TEXT_CHOICES, DependencyMode.ALL.name())
            ));
            return TaskId.of(created.id());
        });
    }

    /**
     * Move a task, with its subtree, before, after or below the target block.
     * Both ids go through mirror resolution.
     */
    public TaskId moveTask(long blockId, long targetBlockId, MovePosition position) {
        if (position == null) {
            throw new IllegalArgumentException("Move position is required");
        }
        Block target = resolveBlock(targetBlockId);
        return mutate("move task " + position.name().toLowerCase(Locale.ROOT) + " " + target.id(), blockId, task -> {
            blockStore.moveBlock(task.id().value(), target.id(), position);
            return task.id();
        });
    }

    /**
     * The one place task data is written: resolve, apply, invalidate.
     */
    private <T> T mutate(String command, long blockId, Function<TaskBlock, T> change) {
        TaskBlock task = resolve(blockId);
        return apply(command, task.id().value(), () -> change.apply(task));
    }

    /**
     * Same as {@link #mutate} for commands whose subject need not be a task.
     */
    private <T> T mutateBlock(String command, long blockId, Function<Block, T> change) {
        Block block = resolveBlock(blockId);
        return apply(command, block.id(), () -> change.apply(block));
    }

    private <T> T apply(String command, long blockId, Supplier<T> change) {
        try {
            T result = change.get();
            log.info("{} on block {}: {}", command, blockId, result);
            return result;
        } finally {
            cache.invalidate();
        }
    }

    private Block resolveBlock(long blockId) {
        TaskId id = identityResolver.canonicalId(blockId);
        return blockStore.findBlock(id.value())
                .orElseThrow(() -> new TaskNotFoundException(blockId, "Block not found: " + blockId));
    }

    private TaskBlock resolve(long blockId) {
        Block block = resolveBlock(blockId);
        TaskId id = TaskId.of(block.id());
        BlockRef tagRef = block.tagRef(schema.tagAlias())
                .orElseThrow(() -> new TaskNotFoundException(blockId,
                        "Block " + blockId + " is not tagged '" + schema.tagAlias() + "'"));

        BlockProperty meta = block.property(TaskSchema.META_PROPERTY).orElse(null);
        TaskPropertyValues values = decoder.decode(id.value(), tagRef, meta, schema);
        return new TaskBlock(id, block, values);
    }

    /**
     * Status change with its time bookkeeping: entering doing fills an empty
     * start time, entering done records the completion time, leaving done
     * clears it.
     */
    private void writeStatus(TaskBlock task, TaskStatus next) {
        TaskPropertyValues current = task.values();
        Instant now = clock.instant();
        List<BlockProperty> updates = new ArrayList<>();

        updates.add(BlockProperty.of(names().status(), PropertyType.TEXT_CHOICES, schema.labelOf(next)));

        if (next == TaskStatus.DOING && current.startTime() == null) {
            updates.add(timeProperty(names().startTime(), now));
        }
        if (next == TaskStatus.DONE && current.status() != TaskStatus.DONE) {
            updates.add(timeProperty(names().completedTime(), now));
        }
        if (next != TaskStatus.DONE && current.status() == TaskStatus.DONE) {
            updates.add(timeProperty(names().completedTime(), null));
        }

        writeTagData(task, updates);
    }

    private void writeTagData(TaskBlock task, List<BlockProperty> properties) {
        blockStore.setTagData(task.id().value(), schema.tagAlias(), properties);
    }

    private BlockProperty timeProperty(String name, Instant value) {
        return BlockProperty.of(name, PropertyType.DATE_TIME, value == null ? null : value.toEpochMilli());
    }

    private static void requireEpochMillis(String name, Instant value) {
        if (value != null && (value.isBefore(EARLIEST_STORED) || value.isAfter(LATEST_STORED))) {
            throw new IllegalArgumentException(name + " is out of range: " + value);
        }
    }

    private ObjectNode readMeta(Block block) {
        Object value = block.property(TaskSchema.META_PROPERTY).map(BlockProperty::value).orElse(null);
        if (value == null) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = value instanceof String
                    ? objectMapper.readTree((String) value)
                    : objectMapper.valueToTree(value);
            if (node != null && node.isObject()) {
                return (ObjectNode) node;
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Block {}: replacing unreadable task meta: {}", block.id(), e.getMessage());
        }
        return objectMapper.createObjectNode();
    }

    private String writeMeta(ObjectNode meta) {
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task meta", e);
        }
    }

    private void putScore(ObjectNode priority, String field, Double value) {
        if (value == null || !Double.isFinite(value)) {
            priority.remove(field);
        } else {
            priority.put(field, Math.max(0.0, Math.min(100.0, value)));
        }
    }

    private TaskSchema.PropertyNames names() {
        return schema.propertyNames();
    }

    private record TaskBlock(TaskId id, Block block, TaskPropertyValues values) {
    }
}
