package com.shortspilot.orchestrator.service;

/**
 * Result class of one invocation, mapped to the process exit code.
 */
public enum RunOutcome {
    WORK_ADVANCED(0),
    NOTHING_ELIGIBLE(3),
    FATAL_STORE_ERROR(1);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() { return exitCode; }
}
