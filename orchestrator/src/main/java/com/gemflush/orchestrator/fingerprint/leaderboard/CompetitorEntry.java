package com.gemflush.orchestrator.fingerprint.leaderboard;

/**
 * One leaderboard row after grouping.
 *
 * @param appearsWithTarget queries in which this competitor and the target were both mentioned
 * @param rank              1 = most mentioned
 */
public record CompetitorEntry(
        String name,
        int mentionCount,
        Double avgPosition,
        int appearsWithTarget,
        int rank
) {
}
