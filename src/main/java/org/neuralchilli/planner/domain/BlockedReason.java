package org.neuralchilli.planner.domain;

import java.util.Collection;
import java.util.Optional;

/**
 * Closed set of reasons that keep a task from being a next action.
 * Declaration order is the display priority used to pick the primary reason.
 */
public enum BlockedReason {
    COMPLETED("completed"),
    CANCELED("canceled"),
    NOT_STARTED("not-started"),
    DEPENDENCY_UNMET("dependency-unmet"),
    DEPENDENCY_DELAYED("dependency-delayed"),
    ANCESTOR_DEPENDENCY_UNMET("ancestor-dependency-unmet"),
    HAS_OPEN_CHILDREN("has-open-children");

    private final String tag;

    BlockedReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Reasons a child inherits from its containment parent
     */
    public boolean isDependencyFamily() {
        return switch (this) {
            case DEPENDENCY_UNMET, DEPENDENCY_DELAYED, ANCESTOR_DEPENDENCY_UNMET -> true;
            case COMPLETED, CANCELED, NOT_STARTED, HAS_OPEN_CHILDREN -> false;
        };
    }

    /**
     * Pick the reason to show when several apply
     */
    public static Optional<BlockedReason> primary(Collection<BlockedReason> reasons) {
        for (BlockedReason reason : values()) {
            if (reasons.contains(reason)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
