package org.neuralchilli.planner.service;

import java.util.Optional;

/**
 * Result of loading a block snapshot.
 * Provides type-safe success/failure handling with clear error messages.
 */
public sealed interface LoadResult {

    /**
     * Check if load was successful
     */
    boolean isSuccess();

    /**
     * Source the snapshot was read from
     */
    String source();

    /**
     * Number of blocks loaded (0 on failure)
     */
    int blockCount();

    /**
     * Get error message if failed
     */
    Optional<String> error();

    record Success(String source, int blockCount) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String source, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public int blockCount() {
            return 0;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String source, int blockCount) {
        return new Success(source, blockCount);
    }

    static LoadResult failure(String source, String error) {
        return new Failure(source, error);
    }

    /**
     * Create a failure result from exception
     */
    static LoadResult failure(String source, Exception e) {
        return new Failure(source, e.getMessage());
    }
}
