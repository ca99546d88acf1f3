package com.gemflush.orchestrator.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.gemflush.orchestrator.publish.CandidateEntity;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable parking place for assembled entities awaiting human review.
 * Entries stay until {@link #delete} is called.
 */
public interface ManualEntityStore {

    /**
     * @param annotations reviewer context stored next to the entity (visibility score, ...)
     * @throws ManualStorageException if the entity could not be written
     */
    StoredManualEntity store(UUID businessId, String businessName, CandidateEntity entity,
                             boolean canPublish, StoredNotability notability,
                             Map<String, Object> annotations);

    /** All entries, newest first. */
    List<StoredManualEntity> list();

    List<StoredManualEntity> listForBusiness(UUID businessId);

    /** The stored entity document (entity plus annotations). */
    JsonNode load(StoredManualEntity ref);

    void delete(StoredManualEntity ref);
}
