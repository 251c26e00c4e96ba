package com.tennis.core.cleaner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tennis.core.model.Match;
import com.tennis.core.model.MatchStatus;
import com.tennis.core.model.Player;
import com.tennis.core.model.SetScore;
import com.tennis.core.model.Surface;
import com.tennis.core.model.Tournament;
import com.tennis.core.model.TournamentCategory;
import com.tennis.core.raw.RawGames;
import com.tennis.core.raw.RawLiveIndicators;
import com.tennis.core.raw.RawMatch;
import com.tennis.core.raw.RawPlayer;
import com.tennis.core.raw.RawScore;
import com.tennis.core.raw.RawSet;
import com.tennis.core.raw.RawTournament;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchCleanerTest {

    private final MatchCleaner cleaner =
            new MatchCleaner(Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));

    private static RawTournament tournament(String name, String location, String city, String country) {
        return new RawTournament("t-1", name, "ATP", "Hard", location, city, country, null, null, null);
    }

    private static RawMatch match(RawTournament tournament, List<RawPlayer> players, RawScore score, String status) {
        return new RawMatch("m-1", tournament, "QF", status, players, score, null, null, null, null, null);
    }

    private static List<RawPlayer> twoPlayers() {
        return List.of(RawPlayer.named("Carlos Alcaraz", "Spain", "ES"), RawPlayer.named("Jannik Sinner", "Italy", "IT"));
    }

    private Match cleanWithLocation(String location, String city, String country) {
        return cleaner.clean(match(tournament("Chengdu Open", location, city, country), twoPlayers(), null, "live"));
    }

    @Nested
    class Location {

        @Test
        void separatorArtifact_fallsBackToDefault() {
            assertThat(cleanWithLocation(", • Hard", null, null).tournament().location()).isEqualTo("Unknown Location");
        }

        @Test
        void surfaceSuffix_isStripped() {
            assertThat(cleanWithLocation("Chengdu, China • Hard", null, null).tournament().location())
                    .isEqualTo("Chengdu, China");
            assertThat(cleanWithLocation("Paris • clay court", null, null).tournament().location())
                    .isEqualTo("Paris");
        }

        @Test
        void cityAndCountry_winOverLocationString() {
            assertThat(cleanWithLocation("junk", "Chengdu", "China").tournament().location()).isEqualTo("Chengdu, China");
            assertThat(cleanWithLocation("junk", "Chengdu", null).tournament().location()).isEqualTo("Chengdu");
            assertThat(cleanWithLocation("junk", null, "China").tournament().location()).isEqualTo("China");
        }

        @Test
        void customFallback_isUsed() {
            RawMatch raw = match(tournament("Chengdu Open", "", null, null), twoPlayers(), null, "live");

            Match cleaned = cleaner.clean(raw, CleaningOptions.defaults().withDefaultLocation("TBD"));

            assertThat(cleaned.tournament().location()).isEqualTo("TBD");
        }
    }

    @Nested
    class TournamentName {

        @Test
        void missingName_isUnknownTournament() {
            assertThat(cleaner.cleanTournamentName(null)).isEqualTo("Unknown Tournament");
            assertThat(cleaner.cleanTournamentName("  ")).isEqualTo("Unknown Tournament");
        }

        @Test
        void completeNames_areKept() {
            assertThat(cleaner.cleanTournamentName("Miami Open")).isEqualTo("Miami Open");
            assertThat(cleaner.cleanTournamentName("Davis Cup Finals QF")).isEqualTo("Davis Cup Finals QF");
        }

        @Test
        void truncatedNames_getQualifier() {
            assertThat(cleaner.cleanTournamentName("Doha")).isEqualTo("Doha Tournament");
            assertThat(cleaner.cleanTournamentName("ATP Rounament")).isEqualTo("ATP Tournament");
            assertThat(cleaner.cleanTournamentName("Qatar Champio")).isEqualTo("Qatar Championship");
        }

        @Test
        void typoFix_skipsCompleteWord() {
            assertThat(cleaner.cleanTournamentName("Tournament of Champions")).isEqualTo("Tournament of Champions");
        }

        @Test
        void absentTournament_getsDefaults() {
            Match cleaned = cleaner.clean(match(null, twoPlayers(), null, "live"));

            Tournament tournament = cleaned.tournament();
            assertThat(tournament.id()).isEqualTo("unknown-tournament");
            assertThat(tournament.name()).isEqualTo("Unknown Tournament");
            assertThat(tournament.category()).isEqualTo(TournamentCategory.UNKNOWN);
            assertThat(tournament.surface()).isEqualTo(Surface.HARD);
            assertThat(tournament.location()).isEqualTo("Unknown Location");
        }

        @Test
        void level_isInferredFromName() {
            RawMatch raw = match(tournament("Australian Open", null, "Melbourne", "Australia"), twoPlayers(), null, "live");

            assertThat(cleaner.clean(raw).tournament().level()).isEqualTo("Grand Slam");
        }
    }

    @Nested
    class Players {

        private Player cleanOne(RawPlayer player) {
            return cleaner.clean(match(tournament("Miami Open", null, "Miami", "USA"),
                    List.of(player, RawPlayer.named("Jannik Sinner", "Italy", "IT")), null, "live")).player1();
        }

        @Test
        void lastFirstName_isReordered() {
            assertThat(cleanOne(RawPlayer.named("Daniel, Taro", "Japan", "JP")).name()).isEqualTo("Taro Daniel");
        }

        @Test
        void lastFirstName_keptWhenNormalizationOff() {
            RawMatch raw = match(tournament("Miami Open", null, null, null),
                    List.of(RawPlayer.named("Daniel, Taro", "Japan", "JP"), RawPlayer.named("B", "Italy", "IT")),
                    null, "live");
            CleaningOptions options = new CleaningOptions(true, true, false, null);

            assertThat(cleaner.clean(raw, options).player1().name()).isEqualTo("Daniel, Taro");
        }

        @Test
        void flagArtifacts_areStripped() {
            assertThat(cleanOne(RawPlayer.named("🇺🇸 Taylor Fritz", "United States", "US")).name())
                    .isEqualTo("Taylor Fritz");
        }

        @Test
        void placeholderName_becomesPlayerN() {
            Match cleaned = cleaner.clean(match(tournament("Miami Open", null, null, null),
                    List.of(RawPlayer.named("Carlos Alcaraz", "Spain", "ES"), RawPlayer.named("-", null, null)),
                    null, "live"));

            assertThat(cleaned.player2().name()).isEqualTo("Player 2");
            assertThat(cleaned.player2().nationality()).isEqualTo("Unknown");
            assertThat(cleaned.player2().countryCode()).isEqualTo("XX");
        }

        @Test
        void wrongPlayerCount_usesPlaceholders() {
            Match cleaned = cleaner.clean(match(tournament("Miami Open", null, null, null),
                    List.of(RawPlayer.named("Solo", "Spain", "ES")), null, "live"));

            assertThat(cleaned.players()).containsExactly(Player.placeholder(1), Player.placeholder(2));
        }

        @Test
        void countryCode_inferredFromNationalityWhenSentinel() {
            assertThat(cleanOne(RawPlayer.named("A B", "Spain", "Neutral")).countryCode()).isEqualTo("ES");
            assertThat(cleanOne(RawPlayer.named("A B", "Spain", "🏳️")).countryCode()).isEqualTo("ES");
            assertThat(cleanOne(RawPlayer.named("A B", "Spain", null)).countryCode()).isEqualTo("ES");
        }

        @Test
        void countryCode_iocMappedAndLowercaseAccepted() {
            assertThat(cleanOne(RawPlayer.named("A B", "Switzerland", "SUI")).countryCode()).isEqualTo("CH");
            assertThat(cleanOne(RawPlayer.named("A B", "Spain", "es")).countryCode()).isEqualTo("ES");
        }

        @Test
        void countryCode_altSpellingUsed() {
            RawPlayer player = new RawPlayer(null, "A B", "Atlantis", null, null, "GR",
                    null, null, null, null, null, null, null);

            assertThat(cleanOne(player).countryCode()).isEqualTo("GR");
        }

        @Test
        void countryCode_unresolvable_isUnknownSentinel() {
            Player player = cleanOne(RawPlayer.named("A B", "Neutral", "N/A"));

            assertThat(player.countryCode()).isEqualTo("XX");
            assertThat(player.nationality()).isEqualTo("Unknown");
        }

        @Test
        void numericFields_parsedLeniently() {
            RawPlayer raw = new RawPlayer("p9", "A B", "Spain", null, "ES", null, "AB",
                    "0", "21.5", "185", "n/a", "Left-handed", "3");

            Player player = cleanOne(raw);

            assertThat(player.id()).isEqualTo("p9");
            assertThat(player.ranking()).isNull();
            assertThat(player.age()).isEqualTo(21);
            assertThat(player.height()).isEqualTo(185);
            assertThat(player.weight()).isNull();
            assertThat(player.seedNumber()).isEqualTo(3);
        }
    }

    @Nested
    class Scores {

        private Match cleanScore(RawScore score) {
            return cleaner.clean(match(tournament("Miami Open", null, null, null), twoPlayers(), score, "live"));
        }

        @Test
        void bothSidesMissing_setDropped() {
            Match cleaned = cleanScore(RawScore.ofSets(List.of(RawSet.of("6", "4"), RawSet.of("-", "-"))));

            assertThat(cleaned.score().sets()).containsExactly(new SetScore(6, 4));
        }

        @Test
        void onlyUnparseableSets_scoreAbsent() {
            assertThat(cleanScore(RawScore.ofSets(List.of(RawSet.of("-", "-")))).score()).isNull();
            assertThat(cleanScore(RawScore.ofSets(List.of(RawSet.of("N/A", "")))).score()).isNull();
        }

        @Test
        void oneSideMissing_countsAsZero() {
            assertThat(cleanScore(RawScore.ofSets(List.of(RawSet.of("3", "-")))).score().sets())
                    .containsExactly(new SetScore(3, 0));
        }

        @Test
        void strictParsing_rejectsTrailingText() {
            assertThat(cleanScore(RawScore.ofSets(List.of(RawSet.of("6x", "4")))).score().sets())
                    .containsExactly(new SetScore(0, 4));

            Match lenient = cleaner.clean(match(tournament("Miami Open", null, null, null), twoPlayers(),
                            RawScore.ofSets(List.of(RawSet.of("6x", "4"))), "live"),
                    new CleaningOptions(true, false, true, null));
            assertThat(lenient.score().sets()).containsExactly(new SetScore(6, 4));
        }

        @Test
        void jsonFloatSides_areReadAsWholeGames() throws Exception {
            RawMatch raw = new ObjectMapper().readValue("""
                    {"status": "live", "score": {"sets": [
                      {"player1": 6.0, "player2": 4},
                      {"player1": "2.5", "player2": 1}
                    ]}}
                    """, RawMatch.class);

            assertThat(cleaner.clean(raw).score().sets())
                    .containsExactly(new SetScore(6, 4), new SetScore(0, 1));
        }

        @Test
        void tiebreakSidesDefaultToZero() {
            RawSet set = new RawSet("7", "6", new RawGames("7", null));

            SetScore cleaned = cleanScore(RawScore.ofSets(List.of(set))).score().sets().get(0);

            assertThat(cleaned.tiebreak().player1()).isEqualTo(7);
            assertThat(cleaned.tiebreak().player2()).isZero();
        }

        @Test
        void setsBeyondFive_discarded() {
            List<RawSet> sets = new ArrayList<>();
            for (int i = 0; i < 7; i++) sets.add(RawSet.of("6", String.valueOf(i % 5)));

            assertThat(cleanScore(RawScore.ofSets(sets)).score().sets()).hasSize(5);
        }

        @Test
        void gamesOnly_keepsScore() {
            Match cleaned = cleanScore(new RawScore(List.of(), new RawGames("2", "1"), new RawGames("-", "-")));

            assertThat(cleaned.score().sets()).isEmpty();
            assertThat(cleaned.score().games().player1()).isEqualTo(2);
            assertThat(cleaned.score().currentSet()).isNull();
        }

        @Test
        void nullSetEntries_areSkipped() {
            Match cleaned = cleanScore(RawScore.ofSets(Arrays.asList(null, RawSet.of("6", "2"))));

            assertThat(cleaned.score().sets()).containsExactly(new SetScore(6, 2));
        }
    }

    @Nested
    class Defaults {

        @Test
        void status_isNormalized() {
            assertThat(cleaner.clean(match(null, twoPlayers(), null, "FT")).status()).isEqualTo(MatchStatus.COMPLETED);
            assertThat(cleaner.clean(match(null, twoPlayers(), null, "ft")).status()).isEqualTo(MatchStatus.COMPLETED);
            assertThat(cleaner.clean(match(null, twoPlayers(), null, "??")).status()).isEqualTo(MatchStatus.SCHEDULED);
        }

        @Test
        void emptyInput_isFullyPopulated() {
            Match cleaned = cleaner.clean(RawMatch.empty());

            assertThat(cleaned.id()).startsWith("match-1717243200000-");
            assertThat(cleaned.round()).isEqualTo("Round 1");
            assertThat(cleaned.status()).isEqualTo(MatchStatus.SCHEDULED);
            assertThat(cleaned.players()).hasSize(2);
            assertThat(cleaned.score()).isNull();
            assertThat(cleaned.liveIndicators().setPoint()).isFalse();
        }

        @Test
        void nullInput_isCleanedToo() {
            assertThat(cleaner.clean(null, null).players()).hasSize(2);
        }

        @Test
        void roundLeftAbsentWithoutFill() {
            RawMatch raw = new RawMatch("m", null, null, "live", twoPlayers(), null, null, null, null, null, null);

            assertThat(cleaner.clean(raw, new CleaningOptions(false, true, true, null)).round()).isNull();
        }

        @Test
        void timestamps_normalizedOrDropped() {
            RawMatch raw = new RawMatch("m", null, "F", "completed", twoPlayers(), null,
                    "2024-01-28T10:30:00+01:00", "garbage", " Rod Laver Arena ", "185",
                    new RawLiveIndicators("3", true, null, false));

            Match cleaned = cleaner.clean(raw);

            assertThat(cleaned.startTime()).isEqualTo("2024-01-28T09:30:00Z");
            assertThat(cleaned.endTime()).isNull();
            assertThat(cleaned.durationMinutes()).isEqualTo(185);
            assertThat(cleaned.liveIndicators().serving()).isNull();
            assertThat(cleaned.liveIndicators().setPoint()).isTrue();
        }
    }

    @Test
    void clean_isIdempotentOnItsOwnOutput() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        RawMatch raw = new RawMatch("m-42",
                tournament("Australian Open", ", • Hard", null, null),
                "SF", "In Progress",
                List.of(RawPlayer.named("Daniel, Taro", "Japan", "Neutral"), RawPlayer.named("🇪🇸 Carlos Alcaraz", "Spain", "ESP")),
                new RawScore(List.of(RawSet.of("6", "4"), RawSet.of("-", "-"), new RawSet("7", "6", new RawGames("7", "3"))),
                        new RawGames("1", "0"), null),
                "2024-01-25T08:00:00Z", null, null, null, new RawLiveIndicators("1", false, false, true));

        Match once = cleaner.clean(raw);
        RawMatch again = mapper.readValue(mapper.writeValueAsString(once), RawMatch.class);
        Match twice = cleaner.clean(again);

        assertThat(twice).isEqualTo(once);
    }
}
