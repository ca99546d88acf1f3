package com.gemflush.orchestrator.publish;

/**
 * Verdict on one search result. A reference qualifies toward notability only
 * when it is serious, publicly available and independent of the business.
 */
public record ReferenceAssessment(
        String url,
        String title,
        ReferenceSourceType sourceType,
        boolean serious,
        boolean publiclyAvailable,
        boolean independent
) {
    public boolean qualifies() {
        return serious && publiclyAvailable && independent;
    }

    public int trustScore() {
        return sourceType.trustScore();
    }
}
