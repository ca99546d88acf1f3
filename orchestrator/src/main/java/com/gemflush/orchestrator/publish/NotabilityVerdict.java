package com.gemflush.orchestrator.publish;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the notability assessment. Not being notable is a normal
 * result, not an error; confidence is meaningful either way.
 */
public record NotabilityVerdict(
        @JsonProperty("isNotable") boolean notable,
        double confidence,
        int seriousReferenceCount,
        int publiclyAvailableCount,
        int independentCount,
        int qualifyingReferenceCount,
        String recommendation,
        @JsonIgnore List<ReferenceAssessment> references
) {
    public NotabilityVerdict {
        references = references == null ? List.of() : List.copyOf(references);
    }

    /** The best qualifying references, highest trust first, for claim citations. */
    public List<ReferenceAssessment> topReferences(int n) {
        return references.stream()
                .filter(ReferenceAssessment::qualifies)
                .sorted((a, b) -> Integer.compare(b.trustScore(), a.trustScore()))
                .limit(n)
                .toList();
    }
}
