package com.tennis.core.loader;

import com.tennis.core.normalize.NumericFields;

import java.util.Map;

/**
 * Winner or loser entry of an archived match.
 */
public record MatchSide(
        String id,
        String name,
        String hand,
        String height,
        String ioc,
        String age,
        String seed,
        String entry,
        Integer rank,
        Integer rankPoints
) {
    /**
     * Reads the {@code winner_} or {@code loser_} columns.
     */
    public static MatchSide from(Map<String, String> row, String prefix) {
        return new MatchSide(
                row.get(prefix + "id"),
                row.get(prefix + "name"),
                row.get(prefix + "hand"),
                row.get(prefix + "ht"),
                row.get(prefix + "ioc"),
                row.get(prefix + "age"),
                row.get(prefix + "seed"),
                row.get(prefix + "entry"),
                NumericFields.parseInt(row.get(prefix + "rank")),
                NumericFields.parseInt(row.get(prefix + "rank_points"))
        );
    }
}
