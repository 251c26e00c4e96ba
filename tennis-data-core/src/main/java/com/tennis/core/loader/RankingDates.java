package com.tennis.core.loader;

import com.tennis.core.normalize.NumericFields;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranking snapshot selection and conversion between compact {@code YYYYMMDD} and
 * hyphenated {@code YYYY-MM-DD} dates.
 */
public final class RankingDates {

    private RankingDates() {
    }

    /**
     * Latest snapshot date, or empty string when there are no rankings.
     */
    public static String latestRankingDate(List<RankingRecord> rankings) {
        return rankings.stream()
                .map(RankingRecord::rankingDate)
                .filter(Objects::nonNull)
                .max(Comparator.comparingLong(RankingDates::dateValue))
                .orElse("");
    }

    public static List<RankingRecord> currentRankings(List<RankingRecord> rankings) {
        return rankingsByDate(rankings, latestRankingDate(rankings));
    }

    /**
     * Exact-date filter, ordered by rank.
     */
    public static List<RankingRecord> rankingsByDate(List<RankingRecord> rankings, String date) {
        return rankings.stream()
                .filter(r -> Objects.equals(r.rankingDate(), date))
                .sorted(Comparator.comparingInt(RankingRecord::rank))
                .toList();
    }

    /**
     * Distinct snapshot dates, most recent first.
     */
    public static List<String> availableRankingDates(List<RankingRecord> rankings) {
        return rankings.stream()
                .map(RankingRecord::rankingDate)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Comparator.comparingLong(RankingDates::dateValue).reversed())
                .toList();
    }

    /**
     * {@code 20240115} to {@code 2024-01-15}; anything not eight characters long is
     * returned unchanged.
     */
    public static String formatDate(String compact) {
        if (compact == null || compact.length() != 8) return compact;
        return compact.substring(0, 4) + "-" + compact.substring(4, 6) + "-" + compact.substring(6, 8);
    }

    /**
     * {@code 2024-01-15} to {@code 20240115}.
     */
    public static String parseDate(String hyphenated) {
        return hyphenated == null ? null : hyphenated.replace("-", "");
    }

    /**
     * Year of a compact or hyphenated date, or null.
     */
    public static Integer yearOf(String date) {
        if (date == null || date.length() < 4) return null;
        return NumericFields.parseInt(date.substring(0, 4));
    }

    private static long dateValue(String date) {
        Integer value = NumericFields.parseInt(parseDate(date));
        return value != null ? value : Long.MIN_VALUE;
    }
}
