package com.gemflush.orchestrator.fingerprint.leaderboard;

/**
 * Maps a competitor's display name to the key used to group mentions.
 * Two names with the same key are counted as one competitor.
 */
@FunctionalInterface
public interface CompetitorNameNormalizer {

    String normalize(String name);
}
