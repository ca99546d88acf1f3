package com.gemflush.orchestrator.fingerprint;

import java.util.List;

/**
 * What one model said about the business. An observation with a non-null
 * error is kept in llmResults but excluded from every metric.
 */
public record ModelObservation(
        String model,
        boolean mentioned,
        Sentiment sentiment,
        double confidence,
        Integer rankPosition,
        List<CompetitorMention> competitorMentions,
        int tokensUsed,
        String error
) {
    public ModelObservation {
        competitorMentions = competitorMentions == null ? List.of() : List.copyOf(competitorMentions);
    }

    public static ModelObservation failed(String model, String error) {
        return new ModelObservation(model, false, Sentiment.NEUTRAL, 0.0, null, List.of(), 0, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
