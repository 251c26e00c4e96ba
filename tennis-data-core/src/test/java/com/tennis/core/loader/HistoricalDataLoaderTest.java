package com.tennis.core.loader;

import com.tennis.core.cache.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HistoricalDataLoaderTest {

    @TempDir
    Path dataDir;

    private MutableClock clock;
    private HistoricalDataLoader loader;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        loader = new HistoricalDataLoader(dataDir, "atp", Duration.ofMinutes(10), clock);
    }

    @Test
    void loadPlayers_readsRegistry() throws IOException {
        Files.writeString(dataDir.resolve("atp_players.csv"), ArchiveFixtures.PLAYERS_CSV);

        List<PlayerRecord> players = loader.loadPlayers();

        assertThat(players).hasSize(3);
        assertThat(players.get(0).fullName()).isEqualTo("Novak Djokovic");
        assertThat(loader.findPlayer("206173")).map(PlayerRecord::ioc).contains("ITA");
        assertThat(loader.findPlayer("1")).isEmpty();
        assertThat(loader.playerRegistry()).containsKeys("104925", "206173", "207989");
    }

    @Test
    void loadCurrentRankings_missingFile_isEmpty() {
        assertThat(loader.loadCurrentRankings()).isEmpty();
    }

    @Test
    void loadCurrentRankings_skipsRowsWithoutRank() throws IOException {
        Files.writeString(dataDir.resolve("atp_rankings_current.csv"), """
                ranking_date,rank,player,points
                20240527,1,206173,9525
                20240527,,207989,8130
                20240527,3,104925,7900
                """);

        assertThat(loader.loadCurrentRankings())
                .extracting(RankingRecord::playerId)
                .containsExactly("206173", "104925");
    }

    @Test
    void loadRankingsForYear_prefersYearFile() throws IOException {
        Files.writeString(dataDir.resolve("atp_rankings_2023.csv"), """
                ranking_date,rank,player,points
                20231231,1,104925,11245
                """);

        assertThat(loader.loadRankingsForYear(2023)).hasSize(1);
    }

    @Test
    void loadRankingsForYear_fallsBackToCurrentFileOfSameYear() throws IOException {
        Files.writeString(dataDir.resolve("atp_rankings_current.csv"), """
                ranking_date,rank,player,points
                20240527,1,206173,9525
                """);

        assertThat(loader.loadRankingsForYear(2024)).hasSize(1);
        assertThat(loader.loadRankingsForYear(2022)).isEmpty();
        assertThat(loader.loadRankingsForYears(List.of(2022, 2024))).hasSize(1);
    }

    @Test
    void availableRankingYears_combinesFilesAndCurrentSnapshot() throws IOException {
        Files.writeString(dataDir.resolve("atp_rankings_2022.csv"), "ranking_date,rank,player,points\n");
        Files.writeString(dataDir.resolve("atp_rankings_2023.csv"), "ranking_date,rank,player,points\n");
        Files.writeString(dataDir.resolve("wta_rankings_2021.csv"), "ranking_date,rank,player,points\n");
        Files.writeString(dataDir.resolve("atp_rankings_current.csv"), """
                ranking_date,rank,player,points
                20240527,1,206173,9525
                """);

        assertThat(loader.availableRankingYears()).containsExactly(2024, 2023, 2022);
    }

    @Test
    void loadMatches_readsYearFile() throws IOException {
        Map<String, String> row = ArchiveFixtures.matchRow("2024-580", "300", "206173", "104925", "6-1 6-2 6-7(6) 6-3");
        row.put("tourney_name", "Australian Open, Melbourne");
        Files.writeString(dataDir.resolve("atp_matches_2024.csv"), ArchiveFixtures.matchesCsv(List.of(row)));

        List<HistoricalMatchRecord> matches = loader.loadMatches(2024);

        assertThat(matches).hasSize(1);
        HistoricalMatchRecord match = matches.get(0);
        assertThat(match.key()).isEqualTo("2024-580_300");
        assertThat(match.tourneyName()).isEqualTo("Australian Open, Melbourne");
        assertThat(match.winner().id()).isEqualTo("206173");
        assertThat(match.winnerStats().aces()).isNull();
        assertThat(loader.loadMatches(2019)).isEmpty();
        assertThat(loader.availableMatchYears()).containsExactly(2024);
    }

    @Test
    void cache_servesStaleDataUntilClearedOrExpired() throws IOException {
        Path file = dataDir.resolve("atp_players.csv");
        Files.writeString(file, ArchiveFixtures.PLAYERS_CSV);
        assertThat(loader.loadPlayers()).hasSize(3);

        Files.writeString(file, "player_id,name_first,name_last,hand,dob,ioc,height,wikidata_id\n");
        assertThat(loader.loadPlayers()).hasSize(3);

        clock.advance(Duration.ofMinutes(11));
        assertThat(loader.loadPlayers()).isEmpty();

        Files.writeString(file, ArchiveFixtures.PLAYERS_CSV);
        loader.clearCache();
        assertThat(loader.loadPlayers()).hasSize(3);
        assertThat(loader.cacheStats()).containsKeys("players", "rankings", "matches");
    }

    @Test
    void availableYears_missingDirectory_isEmpty() {
        HistoricalDataLoader missing = new HistoricalDataLoader(dataDir.resolve("nope"), "atp", Duration.ofMinutes(1), clock);

        assertThat(missing.availableRankingYears()).isEmpty();
        assertThat(missing.availableMatchYears()).isEmpty();
        assertThat(missing.loadPlayers()).isEmpty();
    }
}
