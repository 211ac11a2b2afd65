package org.neuralchilli.planner.domain;

/**
 * Planning status of a task. Labels are host-configurable through
 * {@link TaskSchema}; the semantics here are fixed.
 */
public enum TaskStatus {
    /**
     * Not started yet
     */
    TODO,

    /**
     * Currently being worked on
     */
    DOING,

    /**
     * Parked until something external happens; ranked but never a next action
     */
    WAITING,

    /**
     * Finished
     */
    DONE,

    /**
     * Abandoned
     */
    CANCELED;

    /**
     * Check if this is a terminal state (task finished one way or another)
     */
    public boolean isTerminal() {
        return this == DONE || this == CANCELED;
    }

    /**
     * Open means there is still work to do: neither done nor canceled
     */
    public boolean isOpen() {
        return !isTerminal();
    }

    /**
     * Next status in the main todo → doing → done → todo cycle.
     * Waiting and canceled tasks re-enter the cycle at todo.
     */
    public TaskStatus nextInMainCycle() {
        return switch (this) {
            case TODO -> DOING;
            case DOING -> DONE;
            case DONE, WAITING, CANCELED -> TODO;
        };
    }
}
