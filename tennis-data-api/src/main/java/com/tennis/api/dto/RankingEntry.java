package com.tennis.api.dto;

import com.tennis.core.loader.PlayerRecord;
import com.tennis.core.loader.RankingRecord;
import com.tennis.core.model.Player;
import com.tennis.core.normalize.CountryCodes;

/**
 * One row of a ranking table joined with the player registry.
 */
public record RankingEntry(
        int rank,
        int points,
        String playerId,
        String name,
        String abbreviation,
        String nationality,
        String countryCode
) {
    /**
     * Falls back to a "Player &lt;id&gt;" placeholder when the registry has no entry.
     */
    public static RankingEntry from(RankingRecord ranking, PlayerRecord player) {
        if (player == null) {
            return new RankingEntry(ranking.rank(), ranking.points(), ranking.playerId(),
                    "Player " + ranking.playerId(), null, "Unknown", Player.UNKNOWN_COUNTRY_CODE);
        }
        return new RankingEntry(
                ranking.rank(),
                ranking.points(),
                ranking.playerId(),
                player.fullName(),
                player.abbreviation(),
                player.ioc(),
                CountryCodes.fromIoc(player.ioc())
        );
    }
}
