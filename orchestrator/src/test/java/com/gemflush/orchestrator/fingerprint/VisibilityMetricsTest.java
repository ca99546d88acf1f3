package com.gemflush.orchestrator.fingerprint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VisibilityMetricsTest {

    @Test
    void compute_blendsMentionSentimentAccuracyAndRank() {
        VisibilityMetrics m = VisibilityMetrics.compute(List.of(
                new ModelObservation("a", true, Sentiment.POSITIVE, 0.9, 1, List.of(), 10, null),
                new ModelObservation("b", false, Sentiment.NEUTRAL, 0.9, null, List.of(), 10, null)));

        assertThat(m.mentionRate()).isCloseTo(50.0, within(1e-9));
        assertThat(m.sentimentScore()).isCloseTo(1.0, within(1e-9));
        assertThat(m.accuracyScore()).isCloseTo(0.9, within(1e-9));
        assertThat(m.avgRankPosition()).isCloseTo(1.0, within(1e-9));
        // 20 + 25 + 18 + 15
        assertThat(m.visibilityScore()).isEqualTo(78);
    }

    @Test
    void compute_failedModels_excludedFromRatesButPenalized() {
        VisibilityMetrics m = VisibilityMetrics.compute(List.of(
                new ModelObservation("a", true, Sentiment.POSITIVE, 0.9, 1, List.of(), 10, null),
                new ModelObservation("b", false, Sentiment.NEUTRAL, 0.9, null, List.of(), 10, null),
                ModelObservation.failed("c", "timeout")));

        assertThat(m.mentionRate()).isCloseTo(50.0, within(1e-9));
        assertThat(m.visibilityScore()).isEqualTo(75);
    }

    @Test
    void compute_noMentions_neutralSentimentAndNoRank() {
        VisibilityMetrics m = VisibilityMetrics.compute(List.of(
                new ModelObservation("a", false, Sentiment.NEUTRAL, 0.8, null, List.of(), 10, null)));

        assertThat(m.sentimentScore()).isCloseTo(0.5, within(1e-9));
        assertThat(m.avgRankPosition()).isNull();
        assertThat(m.visibilityScore()).isBetween(0, 100);
    }
}
