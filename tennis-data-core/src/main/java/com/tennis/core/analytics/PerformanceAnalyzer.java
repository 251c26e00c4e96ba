package com.tennis.core.analytics;

import com.tennis.core.loader.HistoricalMatchRecord;
import com.tennis.core.loader.ServeStats;
import com.tennis.core.normalize.TournamentLevels;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Aggregates archive matches into per-player statistics. Matches the player did not
 * take part in are ignored.
 */
public class PerformanceAnalyzer {

    private static final String FINAL_ROUND = "F";

    // ============ RECORDS ============

    public WinLossRecord careerRecord(String playerId, List<HistoricalMatchRecord> matches) {
        int wins = 0;
        int losses = 0;
        for (HistoricalMatchRecord match : matches) {
            if (!match.involves(playerId)) continue;
            if (match.wonBy(playerId)) wins++; else losses++;
        }
        return WinLossRecord.of(wins, losses);
    }

    /**
     * Record per surface, surfaces in alphabetical order.
     */
    public Map<String, WinLossRecord> surfacePerformance(String playerId, List<HistoricalMatchRecord> matches) {
        Map<String, int[]> tallies = new TreeMap<>();
        for (HistoricalMatchRecord match : matches) {
            if (!match.involves(playerId)) continue;
            String surface = match.surface() == null || match.surface().isBlank() ? "Unknown" : match.surface();
            int[] tally = tallies.computeIfAbsent(surface, k -> new int[2]);
            tally[match.wonBy(playerId) ? 0 : 1]++;
        }

        Map<String, WinLossRecord> result = new LinkedHashMap<>();
        tallies.forEach((surface, t) -> result.put(surface, WinLossRecord.of(t[0], t[1])));
        return result;
    }

    /**
     * Record per tier name, most prestigious tier first.
     */
    public List<TierRecord> tierPerformance(String playerId, List<HistoricalMatchRecord> matches) {
        Map<String, int[]> tallies = new LinkedHashMap<>();
        Map<String, Integer> order = new LinkedHashMap<>();

        for (HistoricalMatchRecord match : matches) {
            if (!match.involves(playerId)) continue;
            String level = TournamentLevels.levelName(match.tourneyLevel());
            order.putIfAbsent(level, TournamentLevels.levelOrder(match.tourneyLevel()));

            int[] tally = tallies.computeIfAbsent(level, k -> new int[3]);
            if (match.wonBy(playerId)) {
                tally[0]++;
                if (FINAL_ROUND.equals(match.round())) tally[2]++;
            } else {
                tally[1]++;
            }
        }

        List<TierRecord> records = new ArrayList<>();
        tallies.forEach((level, t) -> records.add(new TierRecord(
                level, t[0], t[1], t[0] + t[1], WinLossRecord.percentage(t[0], t[0] + t[1]), t[2])));
        records.sort(Comparator.comparingInt((TierRecord r) -> order.get(r.level()))
                .thenComparing(TierRecord::level));
        return records;
    }

    // ============ SERVE STATISTICS ============

    public MatchInsights matchInsights(HistoricalMatchRecord match) {
        return new MatchInsights(
                match.key(),
                sideInsights(match.winnerStats(), match.loserStats()),
                sideInsights(match.loserStats(), match.winnerStats())
        );
    }

    private SideInsights sideInsights(ServeStats own, ServeStats opponent) {
        return new SideInsights(
                percentage(own.firstServeIn(), own.servePoints()),
                ratio(own.aces(), own.serviceGames()),
                breakPointConversion(opponent.breakPointsSaved(), opponent.breakPointsFaced())
        );
    }

    /**
     * Career serve rates over matches where the player's serve points column is filled.
     * Each rate only sums matches that carry both of its columns.
     */
    public ServeProfile serveProfile(String playerId, List<HistoricalMatchRecord> matches) {
        int counted = 0;
        Rate firstIn = new Rate();
        Rate firstWon = new Rate();
        Rate secondWon = new Rate();
        Rate aces = new Rate();
        Rate doubleFaults = new Rate();
        Rate bpSaved = new Rate();
        Rate bpConverted = new Rate();

        for (HistoricalMatchRecord match : matches) {
            if (!match.involves(playerId)) continue;
            boolean won = match.wonBy(playerId);
            ServeStats own = won ? match.winnerStats() : match.loserStats();
            ServeStats opponent = won ? match.loserStats() : match.winnerStats();
            if (own.servePoints() == null) continue;

            counted++;
            firstIn.add(own.firstServeIn(), own.servePoints());
            firstWon.add(own.firstServeWon(), own.firstServeIn());
            if (own.firstServeIn() != null) {
                secondWon.add(own.secondServeWon(), own.servePoints() - own.firstServeIn());
            }
            aces.add(own.aces(), own.serviceGames());
            doubleFaults.add(own.doubleFaults(), own.serviceGames());
            bpSaved.add(own.breakPointsSaved(), own.breakPointsFaced());
            if (opponent.breakPointsSaved() != null) {
                bpConverted.add(opponent.breakPointsFaced() == null ? null
                        : opponent.breakPointsFaced() - opponent.breakPointsSaved(), opponent.breakPointsFaced());
            }
        }

        return new ServeProfile(
                playerId,
                counted,
                percentage(firstIn.part, firstIn.whole),
                percentage(firstWon.part, firstWon.whole),
                percentage(secondWon.part, secondWon.whole),
                ratio(aces.part, aces.whole),
                ratio(doubleFaults.part, doubleFaults.whole),
                percentage(bpSaved.part, bpSaved.whole),
                percentage(bpConverted.part, bpConverted.whole)
        );
    }

    // ============ HELPERS ============

    static OptionalDouble percentage(Integer part, Integer whole) {
        if (part == null || whole == null || whole == 0) return OptionalDouble.empty();
        return OptionalDouble.of(round2(part * 100.0 / whole));
    }

    static OptionalDouble ratio(Integer part, Integer whole) {
        if (part == null || whole == null || whole == 0) return OptionalDouble.empty();
        return OptionalDouble.of(round2((double) part / whole));
    }

    /**
     * Share of the opponent's break points that were converted.
     */
    static OptionalDouble breakPointConversion(Integer opponentSaved, Integer opponentFaced) {
        if (opponentSaved == null || opponentFaced == null || opponentFaced == 0) return OptionalDouble.empty();
        return OptionalDouble.of(round2((opponentFaced - opponentSaved) * 100.0 / opponentFaced));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Numerator and denominator totals, both null until a complete pair is seen.
     */
    private static final class Rate {
        private Integer part;
        private Integer whole;

        void add(Integer numerator, Integer denominator) {
            if (numerator == null || denominator == null) return;
            part = part == null ? numerator : part + numerator;
            whole = whole == null ? denominator : whole + denominator;
        }
    }
}
