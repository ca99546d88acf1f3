package com.gemflush.orchestrator.fingerprint.leaderboard;

import java.util.List;

/**
 * Mentions of one raw competitor name before grouping.
 *
 * positions holds every list position seen; avgPosition is only consulted
 * when positions are unavailable (pre-aggregated input).
 */
public record CompetitorTally(
        String name,
        int mentionCount,
        Double avgPosition,
        List<Integer> positions,
        int appearsWithTarget
) {
    public CompetitorTally {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
