package com.gemflush.orchestrator.publish;

import java.util.List;

/**
 * One typed statement on a candidate entity.
 *
 * value is a String for string/url/external-id/item datatypes, or a Map for
 * structured values (coordinates, time, monolingual text).
 */
public record Claim(
        String property,
        String datatype,
        Object value,
        List<String> referenceUrls
) {
    public Claim {
        referenceUrls = referenceUrls == null ? List.of() : List.copyOf(referenceUrls);
    }
}
