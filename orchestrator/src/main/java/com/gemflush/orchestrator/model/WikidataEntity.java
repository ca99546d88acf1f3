package com.gemflush.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One published version of a business's knowledge-graph entity.
 * Republishing inserts version n+1; older rows are history.
 *
 * DB table: wikidata_entities
 */
@Entity
@Table(name = "wikidata_entities")
public class WikidataEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(nullable = false, updatable = false)
    private String qid;

    @Column(name = "entity_data", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String entityData;

    // "test.wikidata.org" or "www.wikidata.org"
    @Column(name = "published_to", nullable = false, updatable = false)
    private String publishedTo;

    @Column(nullable = false, updatable = false)
    private int version;

    // 1 basic, 2 enhanced, 3 complete
    @Column(name = "enrichment_level", nullable = false, updatable = false)
    private int enrichmentLevel;

    @Column(name = "published_at", nullable = false, updatable = false)
    private Instant publishedAt;

    protected WikidataEntity() {}   // required by JPA

    public WikidataEntity(UUID businessId, String qid, String entityData, String publishedTo,
                          int version, int enrichmentLevel, Instant publishedAt) {
        this.businessId      = businessId;
        this.qid             = qid;
        this.entityData      = entityData;
        this.publishedTo     = publishedTo;
        this.version         = version;
        this.enrichmentLevel = enrichmentLevel;
        this.publishedAt     = publishedAt;
    }

    public UUID    getId()              { return id; }
    public UUID    getBusinessId()      { return businessId; }
    public String  getQid()             { return qid; }
    public String  getEntityData()      { return entityData; }
    public String  getPublishedTo()     { return publishedTo; }
    public int     getVersion()         { return version; }
    public int     getEnrichmentLevel() { return enrichmentLevel; }
    public Instant getPublishedAt()     { return publishedAt; }
}
