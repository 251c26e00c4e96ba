package com.tennis.core.loader;

import com.tennis.core.normalize.NumericFields;

import java.util.Map;

/**
 * One completed match from a season archive. Keyed by tournament id and match number.
 */
public record HistoricalMatchRecord(
        String tourneyId,
        String tourneyName,
        String surface,
        String drawSize,
        String tourneyLevel,
        String tourneyDate,
        String matchNum,
        MatchSide winner,
        MatchSide loser,
        String score,
        String bestOf,
        String round,
        Integer minutes,
        ServeStats winnerStats,
        ServeStats loserStats
) {
    public static HistoricalMatchRecord from(Map<String, String> row) {
        return new HistoricalMatchRecord(
                row.get("tourney_id"),
                row.get("tourney_name"),
                row.get("surface"),
                row.get("draw_size"),
                row.get("tourney_level"),
                row.get("tourney_date"),
                row.get("match_num"),
                MatchSide.from(row, "winner_"),
                MatchSide.from(row, "loser_"),
                row.get("score"),
                row.get("best_of"),
                row.get("round"),
                NumericFields.parseInt(row.get("minutes")),
                ServeStats.from(row, "w_"),
                ServeStats.from(row, "l_")
        );
    }

    public String key() {
        return tourneyId + "_" + matchNum;
    }

    public boolean involves(String playerId) {
        return playerId != null && (playerId.equals(winner.id()) || playerId.equals(loser.id()));
    }

    public boolean wonBy(String playerId) {
        return playerId != null && playerId.equals(winner.id());
    }

    public boolean isBetween(String playerId1, String playerId2) {
        return (wonBy(playerId1) && playerId2.equals(loser.id()))
                || (wonBy(playerId2) && playerId1.equals(loser.id()));
    }
}
