package com.tennis.core.loader;

import com.tennis.core.normalize.NumericFields;

import java.util.Map;

/**
 * Optional per-match serve counters for one side; any field is null when the archive
 * left the column empty.
 */
public record ServeStats(
        Integer aces,
        Integer doubleFaults,
        Integer servePoints,
        Integer firstServeIn,
        Integer firstServeWon,
        Integer secondServeWon,
        Integer serviceGames,
        Integer breakPointsSaved,
        Integer breakPointsFaced
) {
    /**
     * Reads the columns carrying the given prefix ({@code w_} or {@code l_}).
     */
    public static ServeStats from(Map<String, String> row, String prefix) {
        return new ServeStats(
                NumericFields.parseInt(row.get(prefix + "ace")),
                NumericFields.parseInt(row.get(prefix + "df")),
                NumericFields.parseInt(row.get(prefix + "svpt")),
                NumericFields.parseInt(row.get(prefix + "1stIn")),
                NumericFields.parseInt(row.get(prefix + "1stWon")),
                NumericFields.parseInt(row.get(prefix + "2ndWon")),
                NumericFields.parseInt(row.get(prefix + "SvGms")),
                NumericFields.parseInt(row.get(prefix + "bpSaved")),
                NumericFields.parseInt(row.get(prefix + "bpFaced"))
        );
    }

    public static ServeStats empty() {
        return new ServeStats(null, null, null, null, null, null, null, null, null);
    }
}
