package com.tennis.core.loader;

import com.tennis.core.normalize.NumericFields;

import java.util.Map;

/**
 * One player's position in a dated ranking snapshot. Dates are compact {@code YYYYMMDD}.
 */
public record RankingRecord(String rankingDate, int rank, String playerId, int points) {

    /**
     * Null when rank is missing or not a number.
     */
    public static RankingRecord from(Map<String, String> row) {
        Integer rank = NumericFields.parseInt(row.get("rank"));
        if (rank == null) return null;
        Integer points = NumericFields.parseInt(row.get("points"));
        return new RankingRecord(row.get("ranking_date"), rank, row.get("player"), points != null ? points : 0);
    }
}
