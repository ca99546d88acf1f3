package com.gemflush.orchestrator.pipeline;

import java.util.UUID;

/**
 * Another run owns the business, or a conditional status update lost its race.
 * The caller may try again later.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final UUID businessId;

    public ConcurrencyConflictException(UUID businessId, String message) {
        super(message);
        this.businessId = businessId;
    }

    public UUID getBusinessId() {
        return businessId;
    }
}
