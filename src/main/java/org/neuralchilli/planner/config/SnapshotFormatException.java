package org.neuralchilli.planner.config;

/**
 * Thrown when a block snapshot document cannot be turned into blocks.
 */
public class SnapshotFormatException extends RuntimeException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
