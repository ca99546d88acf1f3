package com.gemflush.orchestrator.model;

/** Which stage a CrawlJob row records. */
public enum JobType {
    CRAWL,
    FINGERPRINT
}
