package com.tennis.core.model;

/**
 * Incremental snapshot of a live match pushed by the feed.
 */
public record LiveUpdate(
        String matchId,
        String timestamp,
        Score score,
        MatchStatus status,
        LiveIndicators liveIndicators,
        String lastAction
) {
}
