package com.gemflush.orchestrator.pipeline;

import com.gemflush.orchestrator.model.BusinessStatus;

public class IllegalStatusTransitionException extends RuntimeException {

    private final BusinessStatus from;
    private final BusinessStatus to;

    public IllegalStatusTransitionException(BusinessStatus from, BusinessStatus to) {
        super("Illegal status transition " + from + " -> " + to);
        this.from = from;
        this.to   = to;
    }

    public BusinessStatus getFrom() { return from; }
    public BusinessStatus getTo()   { return to; }
}
