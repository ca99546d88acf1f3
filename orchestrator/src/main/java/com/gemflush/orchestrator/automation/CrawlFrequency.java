package com.gemflush.orchestrator.automation;

import java.time.Duration;
import java.util.Optional;

/** How often a stage may run unattended. MANUAL never fires on its own. */
public enum CrawlFrequency {
    MANUAL(null),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration interval;

    CrawlFrequency(Duration interval) {
        this.interval = interval;
    }

    public Optional<Duration> interval() {
        return Optional.ofNullable(interval);
    }
}
