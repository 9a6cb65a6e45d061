package com.ledgersync.event;

import com.ledgersync.domain.enums.IterationState;
import com.ledgersync.domain.model.SyncIterationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a sync iteration ends, whatever its outcome.
 * {@code result} is null for iterations that timed out or failed before producing one.
 */
public class SyncIterationEvent extends ApplicationEvent {

    private final IterationState state;
    private final long durationMs;
    private final SyncIterationResult result;

    public SyncIterationEvent(Object source, IterationState state, long durationMs, SyncIterationResult result) {
        super(source);
        this.state = state;
        this.durationMs = durationMs;
        this.result = result;
    }

    public IterationState getState() {
        return state;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public SyncIterationResult getResult() {
        return result;
    }
}
