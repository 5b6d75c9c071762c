package com.shortspilot.orchestrator.model;

/**
 * Lifecycle states of a {@link WorkItem}.
 *
 * Transitions (happy path):
 *   DISCOVERED → FETCHED → TRANSFORMED → COMPLETED
 *
 * Any non-terminal state can transition to FAILED on a permanent error
 * or once the retry ceiling is exceeded. COMPLETED and FAILED are terminal.
 */
public enum ItemStatus {
    DISCOVERED,
    FETCHED,
    TRANSFORMED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * True when {@code next} is the immediate successor of this state on the
     * happy path, or FAILED from any non-terminal state.
     */
    public boolean canAdvanceTo(ItemStatus next) {
        if (isTerminal() || next == null) return false;
        if (next == FAILED) return true;
        return next.ordinal() == ordinal() + 1;
    }
}
