package com.gemflush.orchestrator.model;

/** Lifecycle of one crawl or fingerprint attempt. */
public enum CrawlJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
