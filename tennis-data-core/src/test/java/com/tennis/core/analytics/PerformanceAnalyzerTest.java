package com.tennis.core.analytics;

import com.tennis.core.loader.ArchiveFixtures;
import com.tennis.core.loader.HistoricalMatchRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceAnalyzerTest {

    private static final String SINNER = "206173";

    private final PerformanceAnalyzer analyzer = new PerformanceAnalyzer();

    private static HistoricalMatchRecord row(String num, String winner, String loser, String surface,
                                             String level, String round) {
        Map<String, String> row = ArchiveFixtures.matchRow("t" + num, num, winner, loser, "6-4 6-4");
        row.put("surface", surface);
        row.put("tourney_level", level);
        row.put("round", round);
        return HistoricalMatchRecord.from(row);
    }

    private final List<HistoricalMatchRecord> season = List.of(
            row("1", SINNER, "104925", "Hard", "G", "F"),
            row("2", SINNER, "104925", "Hard", "G", "SF"),
            row("3", "104925", SINNER, "Clay", "M", "QF"),
            row("4", SINNER, "207989", "Clay", "A", "F"),
            row("5", "207989", "104925", "Grass", "A", "F"));

    @Test
    void careerRecord_countsOnlyOwnMatches() {
        WinLossRecord record = analyzer.careerRecord(SINNER, season);

        assertThat(record).isEqualTo(new WinLossRecord(3, 1, 4, 75.0));
        assertThat(analyzer.careerRecord("nobody", season)).isEqualTo(new WinLossRecord(0, 0, 0, 0.0));
    }

    @Test
    void surfacePerformance_groupsBySurface() {
        Map<String, WinLossRecord> bySurface = analyzer.surfacePerformance(SINNER, season);

        assertThat(bySurface).containsOnlyKeys("Clay", "Hard");
        assertThat(bySurface.get("Hard")).isEqualTo(WinLossRecord.of(2, 0));
        assertThat(bySurface.get("Clay").winPercentage()).isEqualTo(50.0);
    }

    @Test
    void tierPerformance_ordersByPrestigeAndCountsTitles() {
        List<TierRecord> tiers = analyzer.tierPerformance(SINNER, season);

        assertThat(tiers).extracting(TierRecord::level)
                .containsExactly("Grand Slam", "Masters 1000", "ATP 250/500");
        assertThat(tiers.get(0).titles()).isEqualTo(1);
        assertThat(tiers.get(1).titles()).isZero();
        assertThat(tiers.get(2)).isEqualTo(new TierRecord("ATP 250/500", 1, 0, 1, 100.0, 1));
    }

    @Test
    void winPercentage_roundedToTwoDecimals() {
        assertThat(WinLossRecord.of(2, 1).winPercentage()).isEqualTo(66.67);
    }

    @Test
    void matchInsights_computesRatesPerSide() {
        Map<String, String> row = ArchiveFixtures.matchRow("t", "1", SINNER, "104925", "6-4 6-4");
        row.put("w_ace", "10");
        row.put("w_svpt", "80");
        row.put("w_1stIn", "52");
        row.put("w_SvGms", "10");
        row.put("w_bpSaved", "2");
        row.put("w_bpFaced", "3");
        row.put("l_ace", "4");
        row.put("l_svpt", "70");
        row.put("l_1stIn", "40");
        row.put("l_SvGms", "0");
        row.put("l_bpSaved", "3");
        row.put("l_bpFaced", "6");

        MatchInsights insights = analyzer.matchInsights(HistoricalMatchRecord.from(row));

        assertThat(insights.matchKey()).isEqualTo("t_1");
        assertThat(insights.winner().firstServePercentage()).hasValue(65.0);
        assertThat(insights.winner().acesPerServiceGame()).hasValue(1.0);
        assertThat(insights.winner().breakPointConversion()).hasValue(50.0);
        assertThat(insights.loser().firstServePercentage()).hasValue(57.14);
        assertThat(insights.loser().acesPerServiceGame()).isEmpty();
        assertThat(insights.loser().breakPointConversion()).hasValue(33.33);
    }

    @Test
    void matchInsights_missingColumns_areUndetermined() {
        MatchInsights insights = analyzer.matchInsights(ArchiveFixtures.match("t", "1", SINNER, "x", "6-0 6-0"));

        assertThat(insights.winner().firstServePercentage()).isEqualTo(OptionalDouble.empty());
        assertThat(insights.winner().breakPointConversion()).isEmpty();
    }

    @Test
    void matchInsights_opponentFacedNoBreakPoints_isUndetermined() {
        Map<String, String> row = ArchiveFixtures.matchRow("t", "1", SINNER, "104925", "6-4 6-4");
        row.put("l_bpSaved", "0");
        row.put("l_bpFaced", "0");

        assertThat(analyzer.matchInsights(HistoricalMatchRecord.from(row)).winner().breakPointConversion()).isEmpty();
    }

    @Test
    void serveProfile_aggregatesMatchesWithStats() {
        Map<String, String> won = ArchiveFixtures.matchRow("t", "1", SINNER, "104925", "6-4 6-4");
        won.put("w_svpt", "60");
        won.put("w_1stIn", "40");
        won.put("w_1stWon", "30");
        won.put("w_2ndWon", "10");
        won.put("w_ace", "6");
        won.put("w_df", "1");
        won.put("w_SvGms", "10");
        won.put("w_bpSaved", "1");
        won.put("w_bpFaced", "2");
        won.put("l_bpSaved", "2");
        won.put("l_bpFaced", "4");
        Map<String, String> lost = ArchiveFixtures.matchRow("t", "2", "104925", SINNER, "6-4 6-4");
        lost.put("l_svpt", "40");
        lost.put("l_1stIn", "20");
        lost.put("l_1stWon", "12");
        lost.put("l_2ndWon", "10");
        lost.put("l_ace", "2");
        lost.put("l_df", "3");
        lost.put("l_SvGms", "10");
        lost.put("l_bpSaved", "3");
        lost.put("l_bpFaced", "6");
        lost.put("w_bpSaved", "1");
        lost.put("w_bpFaced", "1");
        HistoricalMatchRecord noStats = ArchiveFixtures.match("t", "3", SINNER, "207989", "6-3 6-3");

        ServeProfile profile = analyzer.serveProfile(SINNER,
                List.of(HistoricalMatchRecord.from(won), HistoricalMatchRecord.from(lost), noStats));

        assertThat(profile.matchesWithStats()).isEqualTo(2);
        assertThat(profile.firstServePercentage()).hasValue(60.0);
        assertThat(profile.firstServePointsWon()).hasValue(70.0);
        assertThat(profile.secondServePointsWon()).hasValue(50.0);
        assertThat(profile.acesPerServiceGame()).hasValue(0.4);
        assertThat(profile.doubleFaultsPerServiceGame()).hasValue(0.2);
        assertThat(profile.breakPointsSaved()).hasValue(50.0);
        assertThat(profile.breakPointConversion()).hasValue(40.0);
    }

    @Test
    void serveProfile_partialColumns_pairOnlyCompleteMatches() {
        Map<String, String> full = ArchiveFixtures.matchRow("t", "1", SINNER, "104925", "6-4 6-4");
        full.put("w_svpt", "100");
        full.put("w_1stIn", "60");
        full.put("w_ace", "10");
        full.put("w_SvGms", "10");
        Map<String, String> partial = ArchiveFixtures.matchRow("t", "2", SINNER, "104925", "6-4 6-4");
        partial.put("w_svpt", "100");
        partial.put("w_SvGms", "10");

        ServeProfile profile = analyzer.serveProfile(SINNER,
                List.of(HistoricalMatchRecord.from(full), HistoricalMatchRecord.from(partial)));

        assertThat(profile.matchesWithStats()).isEqualTo(2);
        assertThat(profile.firstServePercentage()).hasValue(60.0);
        assertThat(profile.acesPerServiceGame()).hasValue(1.0);
        assertThat(profile.firstServePointsWon()).isEmpty();
    }

    @Test
    void serveProfile_noStats_isUndetermined() {
        ServeProfile profile = analyzer.serveProfile(SINNER, List.of(ArchiveFixtures.match("t", "1", SINNER, "x", "6-0 6-0")));

        assertThat(profile.matchesWithStats()).isZero();
        assertThat(profile.firstServePercentage()).isEmpty();
    }
}
