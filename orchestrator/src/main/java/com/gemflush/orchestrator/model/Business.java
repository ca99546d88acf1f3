package com.gemflush.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root of the pipeline. Crawl jobs, fingerprints and published
 * entities all hang off one Business.
 *
 * The status column is never written through this entity once the row exists:
 * every transition goes through BusinessRepository's conditional updates,
 * driven by StatusStateMachine. The setter is kept for building rows and tests.
 *
 * DB table: businesses
 */
@Entity
@Table(name = "businesses")
public class Business {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "team_id", nullable = false)
    private Team team;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String url;

    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BusinessStatus status = BusinessStatus.PENDING;

    // Normalized CrawlData serialized as JSON.
    @Column(name = "crawl_data", columnDefinition = "TEXT")
    private String crawlData;

    @Column(name = "wikidata_qid")
    private String wikidataQid;

    @Column(name = "wikidata_published_at")
    private Instant wikidataPublishedAt;

    @Column(name = "automation_enabled", nullable = false)
    private boolean automationEnabled = false;

    @Column(name = "last_crawled_at")
    private Instant lastCrawledAt;

    // Set whenever the publish gate runs, whatever its outcome.
    @Column(name = "last_publish_attempt_at")
    private Instant lastPublishAttemptAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Business() {}   // required by JPA

    public Business(Team team, String name, String url) {
        this.team = team;
        this.name = name;
        this.url  = url;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                  { return id; }
    public Team           getTeam()                { return team; }
    public String         getName()                { return name; }
    public String         getUrl()                 { return url; }
    public String         getCategory()            { return category; }
    public BusinessStatus getStatus()              { return status; }
    public String         getCrawlData()           { return crawlData; }
    public String         getWikidataQid()         { return wikidataQid; }
    public Instant        getWikidataPublishedAt() { return wikidataPublishedAt; }
    public boolean        isAutomationEnabled()    { return automationEnabled; }
    public Instant        getLastCrawledAt()       { return lastCrawledAt; }
    public Instant        getLastPublishAttemptAt() { return lastPublishAttemptAt; }
    public String         getErrorMessage()        { return errorMessage; }
    public Instant        getCreatedAt()           { return createdAt; }
    public Instant        getUpdatedAt()           { return updatedAt; }

    /** CFP-complete: a QID exists. Status and QID are written together. */
    public boolean isPublished() {
        return wikidataQid != null;
    }

    public void setCategory(String category)                 { this.category = category; }
    public void setStatus(BusinessStatus status)             { this.status = status; }
    public void setCrawlData(String crawlData)               { this.crawlData = crawlData; }
    public void setWikidataQid(String wikidataQid)           { this.wikidataQid = wikidataQid; }
    public void setWikidataPublishedAt(Instant at)           { this.wikidataPublishedAt = at; }
    public void setAutomationEnabled(boolean enabled)        { this.automationEnabled = enabled; }
    public void setLastCrawledAt(Instant lastCrawledAt)      { this.lastCrawledAt = lastCrawledAt; }
    public void setLastPublishAttemptAt(Instant at)          { this.lastPublishAttemptAt = at; }
    public void setErrorMessage(String errorMessage)         { this.errorMessage = errorMessage; }
}
