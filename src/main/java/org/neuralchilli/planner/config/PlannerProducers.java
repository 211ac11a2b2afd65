package org.neuralchilli.planner.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.neuralchilli.planner.domain.TaskSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Beans built from configuration: the task schema and the clock passes are
 * evaluated against.
 */
@ApplicationScoped
public class PlannerProducers {

    private static final Logger log = LoggerFactory.getLogger(PlannerProducers.class);

    @Produces
    @Singleton
    TaskSchema taskSchema(PlannerConfig config) {
        PlannerConfig.Schema schema = config.schema();
        PlannerConfig.PropertyNames names = schema.propertyNames();

        TaskSchema taskSchema = new TaskSchema(
                schema.tagAlias(),
                new TaskSchema.PropertyNames(
                        names.status(),
                        names.startTime(),
                        names.endTime(),
                        names.completedTime(),
                        names.dependsOn(),
                        names.dependsMode(),
                        names.dependencyDelay(),
                        names.star()
                ),
                schema.statusChoices(),
                schema.canceledChoices()
        );
        log.info("Task schema: tag '{}', statuses {}", taskSchema.tagAlias(), taskSchema.statusChoices());
        return taskSchema;
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
