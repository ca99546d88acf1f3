package com.gemflush.orchestrator.pipeline;

import java.util.UUID;

/** The business was deleted (or never existed); any run for it is abandoned. */
public class BusinessNotFoundException extends RuntimeException {

    public BusinessNotFoundException(UUID businessId) {
        super("Business not found: " + businessId);
    }
}
