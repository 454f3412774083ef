package org.astar.search;

/**
 * Thrown when attempting to poll an empty {@link StepFrontier}.
 */
public class EmptyFrontierException extends IllegalStateException {
    public EmptyFrontierException(String message) {
        super(message);
    }
}
