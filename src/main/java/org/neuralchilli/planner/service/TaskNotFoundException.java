package org.neuralchilli.planner.service;

/**
 * Thrown when a block id does not resolve to a task.
 * Unchecked: callers at the HTTP boundary map it to 404.
 */
public class TaskNotFoundException extends RuntimeException {

    private final long blockId;

    public TaskNotFoundException(long blockId, String message) {
        super(message);
        this.blockId = blockId;
    }

    public TaskNotFoundException(long blockId) {
        this(blockId, "Task not found: " + blockId);
    }

    public long blockId() {
        return blockId;
    }
}
