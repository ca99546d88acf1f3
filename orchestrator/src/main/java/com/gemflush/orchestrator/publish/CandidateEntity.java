package com.gemflush.orchestrator.publish;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishable entity: labels and descriptions by language code, claims by
 * property id (P31, P856, ...).
 */
public record CandidateEntity(
        Map<String, String> labels,
        Map<String, String> descriptions,
        Map<String, List<Claim>> claims
) {
    public CandidateEntity {
        labels       = Map.copyOf(labels);
        descriptions = Map.copyOf(descriptions);
        claims       = Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public boolean hasClaim(String property) {
        return claims.containsKey(property);
    }

    public int claimCount() {
        return claims.values().stream().mapToInt(List::size).sum();
    }
}
