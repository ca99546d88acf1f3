package com.gemflush.orchestrator.fingerprint;

import java.util.List;

/**
 * Scalar scores of one fingerprint run.
 *
 * Over successful observations only:
 *   mentionRate    = mentioned / successful × 100
 *   sentimentScore = mean of POSITIVE 1, NEUTRAL 0.5, NEGATIVE 0 over mentioned (0.5 if none)
 *   accuracyScore  = mean analysis confidence
 *   avgRank        = mean rank over ranked mentions, null if none
 * visibilityScore blends them (40 mention, 25 sentiment, 20 accuracy, up to
 * 15 for rank) minus up to 10 for failed models, clamped to 0..100.
 */
public record VisibilityMetrics(
        int visibilityScore,
        double mentionRate,
        double sentimentScore,
        double accuracyScore,
        Double avgRankPosition
) {

    public static VisibilityMetrics compute(List<ModelObservation> observations) {
        int total = observations.size();
        int successful = 0;
        int mentioned = 0;
        int ranked = 0;
        double sentimentSum = 0;
        double confidenceSum = 0;
        double rankSum = 0;

        for (ModelObservation o : observations) {
            if (!o.succeeded()) {
                continue;
            }
            successful++;
            confidenceSum += o.confidence();
            if (o.mentioned()) {
                mentioned++;
                sentimentSum += o.sentiment().score();
                if (o.rankPosition() != null) {
                    ranked++;
                    rankSum += o.rankPosition();
                }
            }
        }

        double mentionRate = successful == 0 ? 0.0 : mentioned * 100.0 / successful;
        double sentiment = mentioned == 0 ? 0.5 : sentimentSum / mentioned;
        double accuracy = successful == 0 ? 0.0 : confidenceSum / successful;
        Double avgRank = ranked == 0 ? null : rankSum / ranked;
        double successRate = total == 0 ? 0.0 : (double) successful / total;

        double rankBonus = avgRank == null ? 0.0 : Math.max(0.0, 15.0 - (avgRank - 1.0) * 3.0);
        double raw = mentionRate / 100.0 * 40.0
                + sentiment * 25.0
                + accuracy * 20.0
                + rankBonus
                - (1.0 - successRate) * 10.0;
        int visibility = (int) Math.max(0, Math.min(100, Math.round(raw)));

        return new VisibilityMetrics(visibility, mentionRate, sentiment, accuracy, avgRank);
    }
}
