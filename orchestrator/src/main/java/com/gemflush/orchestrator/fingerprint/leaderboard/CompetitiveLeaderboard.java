package com.gemflush.orchestrator.fingerprint.leaderboard;

import java.util.List;

/**
 * Target plus ranked competitors for one fingerprint run.
 *
 * Market share is derived on read, never stored:
 *   share(c)   = c.mentionCount / totalMentions × 100
 *   mentionRate = target.mentionCount / totalRecommendationQueries × 100
 * totalMentions always equals target + Σ competitors.
 */
public record CompetitiveLeaderboard(
        TargetEntry targetBusiness,
        List<CompetitorEntry> competitors,
        int totalRecommendationQueries
) {
    public CompetitiveLeaderboard {
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
    }

    public int totalMentions() {
        int sum = targetBusiness.mentionCount();
        for (CompetitorEntry c : competitors) {
            sum += c.mentionCount();
        }
        return sum;
    }

    public double marketShare(CompetitorEntry competitor) {
        int total = totalMentions();
        return total == 0 ? 0.0 : competitor.mentionCount() * 100.0 / total;
    }

    /** Whole percentage points for display. */
    public long displayMarketShare(CompetitorEntry competitor) {
        return Math.round(marketShare(competitor));
    }

    public double targetMentionRate() {
        return totalRecommendationQueries == 0
                ? 0.0
                : targetBusiness.mentionCount() * 100.0 / totalRecommendationQueries;
    }

    public List<CompetitorEntry> top(int n) {
        return competitors.subList(0, Math.min(n, competitors.size()));
    }
}
