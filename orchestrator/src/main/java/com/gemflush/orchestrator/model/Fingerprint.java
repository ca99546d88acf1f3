package com.gemflush.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable visibility snapshot. Every column is {@code updatable = false};
 * a new run inserts a new row and "latest" is picked by createdAt.
 *
 * DB table: fingerprints
 */
@Entity
@Table(name = "fingerprints")
public class Fingerprint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "visibility_score", nullable = false, updatable = false)
    private int visibilityScore;

    @Column(name = "mention_rate", nullable = false, updatable = false)
    private double mentionRate;

    @Column(name = "sentiment_score", nullable = false, updatable = false)
    private double sentimentScore;

    @Column(name = "accuracy_score", nullable = false, updatable = false)
    private double accuracyScore;

    @Column(name = "avg_rank_position", updatable = false)
    private Double avgRankPosition;

    // List<ModelObservation> as JSON, in configured model order.
    @Column(name = "llm_results", columnDefinition = "TEXT", updatable = false)
    private String llmResults;

    // CompetitiveLeaderboard as JSON.
    @Column(name = "competitive_leaderboard", columnDefinition = "TEXT", updatable = false)
    private String competitiveLeaderboard;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Fingerprint() {}   // required by JPA

    public Fingerprint(UUID businessId,
                       int visibilityScore,
                       double mentionRate,
                       double sentimentScore,
                       double accuracyScore,
                       Double avgRankPosition,
                       String llmResults,
                       String competitiveLeaderboard,
                       Instant createdAt) {
        this.businessId             = businessId;
        this.visibilityScore        = visibilityScore;
        this.mentionRate            = mentionRate;
        this.sentimentScore         = sentimentScore;
        this.accuracyScore          = accuracyScore;
        this.avgRankPosition        = avgRankPosition;
        this.llmResults             = llmResults;
        this.competitiveLeaderboard = competitiveLeaderboard;
        this.createdAt              = createdAt;
    }

    public UUID    getId()                     { return id; }
    public UUID    getBusinessId()             { return businessId; }
    public int     getVisibilityScore()        { return visibilityScore; }
    public double  getMentionRate()            { return mentionRate; }
    public double  getSentimentScore()         { return sentimentScore; }
    public double  getAccuracyScore()          { return accuracyScore; }
    public Double  getAvgRankPosition()        { return avgRankPosition; }
    public String  getLlmResults()             { return llmResults; }
    public String  getCompetitiveLeaderboard() { return competitiveLeaderboard; }
    public Instant getCreatedAt()              { return createdAt; }
}
