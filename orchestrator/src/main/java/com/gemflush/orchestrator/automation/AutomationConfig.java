package com.gemflush.orchestrator.automation;

/**
 * Automation policy for one team, derived from its subscription.
 * Computed on demand and passed by value; never persisted.
 */
public record AutomationConfig(
        CrawlFrequency crawlFrequency,
        CrawlFrequency fingerprintFrequency,
        boolean autoPublish,
        EntityRichness entityRichness,
        boolean progressiveEnrichment
) {
    public static final AutomationConfig MANUAL_ONLY = new AutomationConfig(
            CrawlFrequency.MANUAL, CrawlFrequency.MANUAL, false, EntityRichness.BASIC, false);
}
