package com.ledgersync.event;

import com.ledgersync.domain.model.ValuationResult;
import org.springframework.context.ApplicationEvent;

/** Published after a valuation batch has been saved. */
public class ValuationEvent extends ApplicationEvent {

    private final ValuationResult result;

    public ValuationEvent(Object source, ValuationResult result) {
        super(source);
        this.result = result;
    }

    public ValuationResult getResult() {
        return result;
    }
}
