package com.tennis.core.analytics;

import java.util.OptionalDouble;

/**
 * Career serve aggregates over the matches that carry serve statistics.
 *
 * @param matchesWithStats number of matches that contributed
 */
public record ServeProfile(
        String playerId,
        int matchesWithStats,
        OptionalDouble firstServePercentage,
        OptionalDouble firstServePointsWon,
        OptionalDouble secondServePointsWon,
        OptionalDouble acesPerServiceGame,
        OptionalDouble doubleFaultsPerServiceGame,
        OptionalDouble breakPointsSaved,
        OptionalDouble breakPointConversion
) {
}
