package com.gemflush.orchestrator.fingerprint.leaderboard;

/** The business being fingerprinted. rank is null when no response ranked it. */
public record TargetEntry(
        String name,
        Integer rank,
        int mentionCount,
        Double avgPosition
) {
}
