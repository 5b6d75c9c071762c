package com.shortspilot.orchestrator.model;

/**
 * Thrown when code attempts to move a WorkItem backwards, skip a state,
 * leave a terminal state, or rewrite data that is append-only.
 */
public class IllegalStateTransitionException extends RuntimeException {

    public IllegalStateTransitionException(String message) {
        super(message);
    }
}
