package com.gemflush.orchestrator.storage;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata of one entity parked for manual review. The entity itself lives in
 * entityFileName; this record is what metadataFileName holds.
 */
public record StoredManualEntity(
        UUID businessId,
        String businessName,
        String entityFileName,
        String metadataFileName,
        boolean canPublish,
        StoredNotability notability,
        Instant storedAt
) {
}
