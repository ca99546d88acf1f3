package com.gemflush.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One attempt of a pipeline stage against a business.
 *
 * Append-only per business: a retry after a failed run creates a new row
 * rather than reopening the old one.
 *
 * DB table: crawl_jobs
 */
@Entity
@Table(name = "crawl_jobs")
public class CrawlJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, updatable = false)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CrawlJobStatus status = CrawlJobStatus.QUEUED;

    // 0-100
    @Column(nullable = false)
    private int progress = 0;

    @Column(name = "result", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected CrawlJob() {}   // required by JPA

    public CrawlJob(UUID businessId, JobType jobType) {
        this.businessId = businessId;
        this.jobType    = jobType;
    }

    // ------------------------------------------------------------------
    // State changes
    // ------------------------------------------------------------------

    public void markRunning(Instant now) {
        this.status    = CrawlJobStatus.RUNNING;
        this.progress  = 10;
        this.startedAt = now;
    }

    public void markCompleted(String resultJson, Instant now) {
        this.status       = CrawlJobStatus.COMPLETED;
        this.progress     = 100;
        this.resultJson   = resultJson;
        this.errorMessage = null;
        this.completedAt  = now;
    }

    public void markFailed(String errorMessage, Instant now) {
        this.status       = CrawlJobStatus.FAILED;
        this.progress     = 0;
        this.errorMessage = errorMessage;
        this.completedAt  = now;
    }

    public UUID           getId()           { return id; }
    public UUID           getBusinessId()   { return businessId; }
    public JobType        getJobType()      { return jobType; }
    public CrawlJobStatus getStatus()       { return status; }
    public int            getProgress()     { return progress; }
    public String         getResultJson()   { return resultJson; }
    public String         getErrorMessage() { return errorMessage; }
    public Instant        getStartedAt()    { return startedAt; }
    public Instant        getCompletedAt()  { return completedAt; }
    public Instant        getCreatedAt()    { return createdAt; }
}
