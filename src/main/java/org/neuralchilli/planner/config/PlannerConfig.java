package org.neuralchilli.planner.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "planner")
public interface PlannerConfig {

    @WithName("schema")
    Schema schema();

    @WithName("snapshot")
    Snapshot snapshot();

    interface Schema {

        @WithName("tag-alias")
        @WithDefault("Task")
        String tagAlias();

        /**
         * Labels for todo, doing, waiting and done, in that order
         */
        @WithName("status-choices")
        @WithDefault("TODO,Doing,Waiting,Done")
        List<String> statusChoices();

        @WithName("canceled-choices")
        @WithDefault("Canceled,Cancelled")
        List<String> canceledChoices();

        @WithName("property-names")
        PropertyNames propertyNames();
    }

    interface PropertyNames {

        @WithDefault("Status")
        String status();

        @WithName("start-time")
        @WithDefault("Start time")
        String startTime();

        @WithName("end-time")
        @WithDefault("End time")
        String endTime();

        @WithName("completed-time")
        @WithDefault("Completed time")
        String completedTime();

        @WithName("depends-on")
        @WithDefault("Depends on")
        String dependsOn();

        @WithName("depends-mode")
        @WithDefault("Depends mode")
        String dependsMode();

        @WithName("dependency-delay")
        @WithDefault("Dependency delay")
        String dependencyDelay();

        @WithDefault("Star")
        String star();
    }

    interface Snapshot {

        /**
         * YAML block snapshot loaded at startup; nothing is loaded when unset
         */
        Optional<String> path();

        @WithDefault("true")
        boolean watch();
    }
}
