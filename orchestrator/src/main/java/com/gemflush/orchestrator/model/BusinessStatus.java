package com.gemflush.orchestrator.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a business through the CFP pipeline.
 *
 * The allowed transitions live here so every status write can be validated
 * against one table instead of trusting the caller:
 *
 *   PENDING ──► CRAWLING ──► CRAWLED ──► GENERATING ──► PUBLISHED
 *      ▲            │           ▲  │          │
 *      │            ▼           └──┼──────────┘ (publish reverted)
 *      └──────── ERROR ◄───────────┘
 *
 * ERROR can also go straight back to CRAWLING when a user retries.
 */
public enum BusinessStatus {
    PENDING,
    CRAWLING,
    CRAWLED,
    GENERATING,
    PUBLISHED,
    ERROR;

    private static final Map<BusinessStatus, Set<BusinessStatus>> ALLOWED = Map.of(
            PENDING,    EnumSet.of(CRAWLING, ERROR),
            CRAWLING,   EnumSet.of(CRAWLED, ERROR),
            CRAWLED,    EnumSet.of(CRAWLING, GENERATING, ERROR),
            GENERATING, EnumSet.of(PUBLISHED, CRAWLED, ERROR),
            PUBLISHED,  EnumSet.noneOf(BusinessStatus.class),
            ERROR,      EnumSet.of(PENDING, CRAWLING)
    );

    public boolean canTransitionTo(BusinessStatus target) {
        return ALLOWED.get(this).contains(target);
    }

    public Set<BusinessStatus> allowedTargets() {
        // values are EnumSets, so copyOf is safe for the empty PUBLISHED entry
        return EnumSet.copyOf(ALLOWED.get(this));
    }

    /** A stage is currently writing to this business. */
    public boolean isInFlight() {
        return this == CRAWLING || this == GENERATING;
    }

    public boolean isTerminal() {
        return this == PUBLISHED || this == ERROR;
    }

    /** Lower-case name exposed to the API layer ("pending", "crawled", ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
