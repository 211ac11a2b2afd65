package org.neuralchilli.planner.domain;

import java.util.List;
import java.util.Locale;

/**
 * Host-side description of the task tag: its alias, the property names in its
 * payload, and the labels used for each status.
 *
 * Status choices are ordered todo, doing, waiting, done.
 */
public record TaskSchema(
        String tagAlias,
        PropertyNames propertyNames,
        List<String> statusChoices,
        List<String> canceledChoices
) {
    public static final String DEFAULT_TAG_ALIAS = "Task";
    public static final String META_PROPERTY = "_mlo_task_meta";

    public TaskSchema {
        if (tagAlias == null || tagAlias.isBlank()) {
            throw new IllegalArgumentException("Task tag alias cannot be null or empty");
        }
        if (propertyNames == null) {
            throw new IllegalArgumentException("Property names cannot be null");
        }
        if (statusChoices == null || statusChoices.size() != 4) {
            throw new IllegalArgumentException(
                    "Status choices must list exactly 4 labels (todo, doing, waiting, done), got: " + statusChoices
            );
        }
        statusChoices = List.copyOf(statusChoices);
        canceledChoices = canceledChoices == null ? List.of() : List.copyOf(canceledChoices);
    }

    /**
     * Property names carried in the task tag payload
     */
    public record PropertyNames(
            String status,
            String startTime,
            String endTime,
            String completedTime,
            String dependsOn,
            String dependsMode,
            String dependencyDelay,
            String star
    ) {
        public static PropertyNames defaults() {
            return new PropertyNames(
                    "Status",
                    "Start time",
                    "End time",
                    "Completed time",
                    "Depends on",
                    "Depends mode",
                    "Dependency delay",
                    "Star"
            );
        }
    }

    public static TaskSchema defaults() {
        return new TaskSchema(
                DEFAULT_TAG_ALIAS,
                PropertyNames.defaults(),
                List.of("TODO", "Doing", "Waiting", "Done"),
                List.of("Canceled", "Cancelled")
        );
    }

    public TaskSchema withTagAlias(String alias) {
        return new TaskSchema(alias, propertyNames, statusChoices, canceledChoices);
    }

    /**
     * Map a stored status label to its status. Unknown or missing labels are todo.
     */
    public TaskStatus statusOf(String label) {
        if (label == null) {
            return TaskStatus.TODO;
        }
        if (label.equals(statusChoices.get(0))) {
            return TaskStatus.TODO;
        }
        if (label.equals(statusChoices.get(1))) {
            return TaskStatus.DOING;
        }
        if (label.equals(statusChoices.get(2))) {
            return TaskStatus.WAITING;
        }
        if (label.equals(statusChoices.get(3))) {
            return TaskStatus.DONE;
        }
        if (isCanceledLabel(label)) {
            return TaskStatus.CANCELED;
        }
        return TaskStatus.TODO;
    }

    /**
     * Label to store for a status
     */
    public String labelOf(TaskStatus status) {
        return switch (status) {
            case TODO -> statusChoices.get(0);
            case DOING -> statusChoices.get(1);
            case WAITING -> statusChoices.get(2);
            case DONE -> statusChoices.get(3);
            case CANCELED -> canceledChoices.isEmpty() ? "Canceled" : canceledChoices.get(0);
        };
    }

    private boolean isCanceledLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return canceledChoices.stream()
                .anyMatch(choice -> choice.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }
}
