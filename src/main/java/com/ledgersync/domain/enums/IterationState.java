package com.ledgersync.domain.enums;

/**
 * Sync orchestrator state machine: IDLE -> RUNNING -> {COMPLETED, TIMED_OUT, FAILED}.
 * A finished state accepts a new iteration, RUNNING does not.
 */
public enum IterationState {
    IDLE,
    RUNNING,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean acceptsNewIteration() {
        return this != RUNNING;
    }
}
