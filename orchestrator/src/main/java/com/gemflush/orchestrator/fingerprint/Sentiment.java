package com.gemflush.orchestrator.fingerprint;

public enum Sentiment {
    POSITIVE(1.0),
    NEUTRAL(0.5),
    NEGATIVE(0.0);

    private final double score;

    Sentiment(double score) {
        this.score = score;
    }

    /** 0..1 contribution to the fingerprint's sentimentScore. */
    public double score() {
        return score;
    }
}
