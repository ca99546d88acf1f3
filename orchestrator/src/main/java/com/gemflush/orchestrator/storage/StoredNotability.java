package com.gemflush.orchestrator.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gemflush.orchestrator.publish.NotabilityVerdict;

/** The part of a notability verdict a reviewer needs next to the entity. */
public record StoredNotability(
        @JsonProperty("isNotable") boolean notable,
        double confidence,
        String recommendation
) {
    public static StoredNotability of(NotabilityVerdict verdict) {
        return verdict == null ? null
                : new StoredNotability(verdict.notable(), verdict.confidence(), verdict.recommendation());
    }
}
