package org.neuralchilli.planner.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.BlockRef;
import org.neuralchilli.planner.domain.DependencyMode;
import org.neuralchilli.planner.domain.TaskPropertyValues;
import org.neuralchilli.planner.domain.TaskSchema;
import org.neuralchilli.planner.domain.TaskStatus;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Decodes a task tag payload and the block's priority meta into
 * {@link TaskPropertyValues}.
 *
 * Never fails: a value that is missing or malformed falls back to the schema
 * default, so one bad task cannot break a whole evaluation pass.
 */
@ApplicationScoped
public class TaskPropertyDecoder {

    private static final Logger log = LoggerFactory.getLogger(TaskPropertyDecoder.class);

    private final ObjectMapper objectMapper;
    private final EvaluationMonitor monitor;

    @Inject
    public TaskPropertyDecoder(ObjectMapper objectMapper, EvaluationMonitor monitor) {
        this.objectMapper = objectMapper;
        this.monitor = monitor;
    }

    /**
     * Decode one task.
     *
     * @param blockId      block the payload belongs to (for diagnostics only)
     * @param tagRef       the task tag reference, or null when the block has none
     * @param metaProperty the block's priority meta property, or null
     * @param schema       task schema naming the payload properties
     */
    public TaskPropertyValues decode(
            long blockId,
            BlockRef tagRef,
            BlockProperty metaProperty,
            TaskSchema schema
    ) {
        if (tagRef == null) {
            return TaskPropertyValues.defaults();
        }

        TaskSchema.PropertyNames names = schema.propertyNames();
        Reader reader = new Reader(blockId, tagRef);

        TaskStatus status = schema.statusOf(reader.string(names.status()).orElse(null));
        Instant startTime = reader.instant(names.startTime());
        Instant endTime = reader.instant(names.endTime());
        Instant completedTime = reader.instant(names.completedTime());
        boolean star = reader.bool(names.star());
        List<Long> dependsOn = reader.ids(names.dependsOn());
        DependencyMode mode = DependencyMode.fromString(reader.string(names.dependsMode()).orElse(null));
        Double delay = reader.nonNegativeNumber(names.dependencyDelay());

        Priority priority = decodePriority(blockId, metaProperty);

        return new TaskPropertyValues(
                status,
                startTime,
                endTime,
                completedTime,
                priority.importance(),
                priority.urgency(),
                priority.effort(),
                star,
                dependsOn,
                mode,
                delay
        );
    }

    private Priority decodePriority(long blockId, BlockProperty metaProperty) {
        if (metaProperty == null || metaProperty.value() == null) {
            return Priority.NONE;
        }

        JsonNode root;
        try {
            Object value = metaProperty.value();
            root = value instanceof String
                    ? objectMapper.readTree((String) value)
                    : objectMapper.valueToTree(value);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            fallback(blockId, TaskSchema.META_PROPERTY, metaProperty.value());
            return Priority.NONE;
        }

        JsonNode priority = root == null ? null : root.path("priority");
        if (priority == null || !priority.isObject()) {
            return Priority.NONE;
        }

        return new Priority(
                score(blockId, priority, "importance"),
                score(blockId, priority, "urgency"),
                score(blockId, priority, "effort")
        );
    }

    private Double score(long blockId, JsonNode priority, String field) {
        JsonNode node = priority.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            fallback(blockId, "priority." + field, node);
            return null;
        }
        return Math.max(0.0, Math.min(100.0, node.asDouble()));
    }

    private void fallback(long blockId, String property, Object value) {
        monitor.recordDecodeFallback();
        log.warn("Block {}: ignoring malformed value for '{}': {}", blockId, property, value);
    }

    private record Priority(Double importance, Double urgency, Double effort) {
        static final Priority NONE = new Priority(null, null, null);
    }

    /**
     * Typed, lenient accessors over one tag payload
     */
    private final class Reader {
        private final long blockId;
        private final BlockRef tagRef;

        Reader(long blockId, BlockRef tagRef) {
            this.blockId = blockId;
            this.tagRef = tagRef;
        }

        private Optional<Object> raw(String name) {
            return tagRef.property(name).map(BlockProperty::value);
        }

        Optional<String> string(String name) {
            Optional<Object> value = raw(name);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            if (value.get() instanceof String) {
                return Optional.of((String) value.get());
            }
            // Choice properties may hold a single-element list
            if (value.get() instanceof List<?>) {
                List<?> list = (List<?>) value.get();
                if (list.size() == 1 && list.get(0) instanceof String) {
                    return Optional.of((String) list.get(0));
                }
            }
            fallback(blockId, name, value.get());
            return Optional.empty();
        }

        Instant instant(String name) {
            Optional<Object> value = raw(name);
            if (value.isEmpty()) {
                return null;
            }
            Instant parsed = toInstant(value.get());
            if (parsed == null) {
                fallback(blockId, name, value.get());
            }
            return parsed;
        }

        boolean bool(String name) {
            return raw(name).map(Boolean.TRUE::equals).orElse(false);
        }

        List<Long> ids(String name) {
            Optional<Object> value = raw(name);
            if (value.isEmpty()) {
                return List.of();
            }
            if (!(value.get() instanceof List<?>)) {
                fallback(blockId, name, value.get());
                return List.of();
            }

            List<Long> ids = new ArrayList<>();
            for (Object item : (List<?>) value.get()) {
                Long id = toLong(item);
                if (id == null) {
                    fallback(blockId, name, item);
                } else if (!ids.contains(id)) {
                    ids.add(id);
                }
            }
            return ids;
        }

        Double nonNegativeNumber(String name) {
            Optional<Object> value = raw(name);
            if (value.isEmpty()) {
                return null;
            }
            if (value.get() instanceof Number) {
                double d = ((Number) value.get()).doubleValue();
                if (Double.isFinite(d) && d >= 0) {
                    return d;
                }
            }
            fallback(blockId, name, value.get());
            return null;
        }
    }

    /**
     * Instant from a stored date value: an instant, a date, epoch millis or an
     * ISO-8601 string (zone-less values are read as UTC). Null when unreadable.
     */
    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return parseInstant(((String) value).trim());
        }
        return null;
    }

    private static Instant parseInstant(String text) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return parseDate(text);
        }
    }

    private static Instant parseDate(String text) {
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
