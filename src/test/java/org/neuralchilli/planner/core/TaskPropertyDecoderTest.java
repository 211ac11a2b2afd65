package org.neuralchilli.planner.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.DependencyMode;
import org.neuralchilli.planner.domain.PropertyType;
import org.neuralchilli.planner.domain.TaskPropertyValues;
import org.neuralchilli.planner.domain.TaskSchema;
import org.neuralchilli.planner.domain.TaskStatus;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.planner.BlockFixtures.*;

class TaskPropertyDecoderTest {

    private final EvaluationMonitor monitor = new EvaluationMonitor();
    private final TaskPropertyDecoder decoder = new TaskPropertyDecoder(new ObjectMapper(), monitor);
    private final TaskSchema schema = TaskSchema.defaults();

    private TaskPropertyValues decode(Map<String, Object> data) {
        return decoder.decode(1L, tagRef(data), null, schema);
    }

    @Test
    void shouldReturnDefaultsForEmptyPayload() {
        TaskPropertyValues values = decode(Map.of());

        assertThat(values).isEqualTo(TaskPropertyValues.defaults());
        assertThat(monitor.getDecodeFallbacks()).isZero();
    }

    @Test
    void shouldReturnDefaultsWithoutTag() {
        assertThat(decoder.decode(1L, null, null, schema)).isEqualTo(TaskPropertyValues.defaults());
    }

    @Test
    void shouldDecodeFullPayload() {
        TaskPropertyValues values = decode(data(
                "Status", "Doing",
                "Start time", "2024-06-01T08:00:00Z",
                "End time", 1717416000000L,
                "Completed time", "2024-06-02",
                "Star", true,
                "Depends on", List.of(20, 21),
                "Depends mode", "ANY",
                "Dependency delay", 12
        ));

        assertThat(values.status()).isEqualTo(TaskStatus.DOING);
        assertThat(values.startTime()).isEqualTo(Instant.parse("2024-06-01T08:00:00Z"));
        assertThat(values.endTime()).isEqualTo(Instant.ofEpochMilli(1717416000000L));
        assertThat(values.completedTime()).isEqualTo(Instant.parse("2024-06-02T00:00:00Z"));
        assertThat(values.star()).isTrue();
        assertThat(values.dependsOn()).containsExactly(20L, 21L);
        assertThat(values.dependsMode()).isEqualTo(DependencyMode.ANY);
        assertThat(values.dependencyDelayHours()).isEqualTo(12.0);
    }

    @Test
    void shouldMapStatusLabels() {
        assertThat(decode(data("Status", "TODO")).status()).isEqualTo(TaskStatus.TODO);
        assertThat(decode(data("Status", "Waiting")).status()).isEqualTo(TaskStatus.WAITING);
        assertThat(decode(data("Status", "Done")).status()).isEqualTo(TaskStatus.DONE);
        assertThat(decode(data("Status", "Cancelled")).status()).isEqualTo(TaskStatus.CANCELED);
        assertThat(decode(data("Status", List.of("Doing"))).status()).isEqualTo(TaskStatus.DOING);
    }

    @Test
    void shouldTreatUnknownStatusAsTodo() {
        assertThat(decode(data("Status", "Someday")).status()).isEqualTo(TaskStatus.TODO);
    }

    @Test
    void shouldReadDateValues() {
        Instant instant = Instant.parse("2024-06-01T10:15:00Z");

        assertThat(decode(data("Start time", Date.from(instant))).startTime()).isEqualTo(instant);
        assertThat(decode(data("Start time", "2024-06-01T10:15:00")).startTime()).isEqualTo(instant);
        assertThat(decode(data("Start time", "2024-06-01T12:15:00+02:00")).startTime()).isEqualTo(instant);
    }

    @Test
    void shouldFallBackOnMalformedValues() {
        // Given: Every field holds something unreadable
        TaskPropertyValues values = decode(data(
                "Status", 42,
                "Start time", "next tuesday",
                "Depends on", "20",
                "Dependency delay", -4
        ));

        // Then: Defaults, and each fallback is counted
        assertThat(values.status()).isEqualTo(TaskStatus.TODO);
        assertThat(values.startTime()).isNull();
        assertThat(values.dependsOn()).isEmpty();
        assertThat(values.dependencyDelayHours()).isNull();
        assertThat(monitor.getDecodeFallbacks()).isEqualTo(4);
    }

    @Test
    void shouldDropUnreadableDependencyEntries() {
        TaskPropertyValues values = decode(data("Depends on", List.of(20, "x", "21", 20)));

        assertThat(values.dependsOn()).containsExactly(20L, 21L);
        assertThat(monitor.getDecodeFallbacks()).isEqualTo(1);
    }

    @Test
    void shouldTreatNonBooleanStarAsFalse() {
        assertThat(decode(data("Star", "yes")).star()).isFalse();
    }

    @Test
    void shouldTreatUnknownModeAsAll() {
        assertThat(decode(data("Depends mode", "SOME")).dependsMode()).isEqualTo(DependencyMode.ALL);
        assertThat(decode(data("Depends mode", "any")).dependsMode()).isEqualTo(DependencyMode.ANY);
    }

    @Test
    void shouldDecodePriorityMetaFromMap() {
        TaskPropertyValues values = decoder.decode(1L, tagRef(Map.of()), meta(80, 30.5, 10), schema);

        assertThat(values.importance()).isEqualTo(80.0);
        assertThat(values.urgency()).isEqualTo(30.5);
        assertThat(values.effort()).isEqualTo(10.0);
    }

    @Test
    void shouldDecodePriorityMetaFromJsonString() {
        BlockProperty meta = BlockProperty.of(TaskSchema.META_PROPERTY, PropertyType.JSON,
                "{\"priority\":{\"importance\":150,\"urgency\":-5}}");

        TaskPropertyValues values = decoder.decode(1L, tagRef(Map.of()), meta, schema);

        assertThat(values.importance()).isEqualTo(100.0);
        assertThat(values.urgency()).isEqualTo(0.0);
        assertThat(values.effort()).isNull();
    }

    @Test
    void shouldIgnoreBrokenPriorityMeta() {
        BlockProperty broken = BlockProperty.of(TaskSchema.META_PROPERTY, PropertyType.JSON, "{not json");
        BlockProperty textScore = meta("high", null, null);

        TaskPropertyValues fromBroken = decoder.decode(1L, tagRef(Map.of()), broken, schema);
        TaskPropertyValues fromText = decoder.decode(1L, tagRef(Map.of()), textScore, schema);

        assertThat(fromBroken.importance()).isNull();
        assertThat(fromText.importance()).isNull();
        assertThat(monitor.getDecodeFallbacks()).isEqualTo(2);
    }

    @Test
    void shouldHonourCustomPropertyNames() {
        TaskSchema custom = new TaskSchema(
                "Todo",
                new TaskSchema.PropertyNames("State", "Begin", "Due", "Finished", "After", "After mode", "Wait", "Fav"),
                List.of("Open", "Active", "Parked", "Closed"),
                List.of("Dropped")
        );

        TaskPropertyValues values = decoder.decode(1L, tagRef(data("State", "Parked", "Fav", true)), null, custom);

        assertThat(values.status()).isEqualTo(TaskStatus.WAITING);
        assertThat(values.star()).isTrue();
    }
}
