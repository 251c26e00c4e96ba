package com.tennis.core.cleaner;

import com.tennis.core.model.GamePair;
import com.tennis.core.model.LiveIndicators;
import com.tennis.core.model.Match;
import com.tennis.core.model.MatchStatus;
import com.tennis.core.model.Player;
import com.tennis.core.model.Score;
import com.tennis.core.model.SetScore;
import com.tennis.core.model.Surface;
import com.tennis.core.model.Tournament;
import com.tennis.core.model.TournamentCategory;
import com.tennis.core.normalize.CountryCodes;
import com.tennis.core.normalize.NumericFields;
import com.tennis.core.normalize.PlayerNames;
import com.tennis.core.normalize.Timestamps;
import com.tennis.core.normalize.TournamentLevels;
import com.tennis.core.normalize.Vocabulary;
import com.tennis.core.raw.RawGames;
import com.tennis.core.raw.RawLiveIndicators;
import com.tennis.core.raw.RawMatch;
import com.tennis.core.raw.RawPlayer;
import com.tennis.core.raw.RawScore;
import com.tennis.core.raw.RawSet;
import com.tennis.core.raw.RawTournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Repairs partial, inconsistently formatted source matches into canonical {@link Match}
 * instances. Cleaning never fails: whatever cannot be read is replaced by a default.
 */
public class MatchCleaner {

    private static final Logger log = LoggerFactory.getLogger(MatchCleaner.class);

    private static final String DEFAULT_ROUND = "Round 1";
    private static final String UNKNOWN_NATIONALITY = "Unknown";

    private static final Pattern SURFACE_SUFFIX =
            Pattern.compile("\\s*•\\s*(hard|clay|grass|indoor|carpet).*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRICT_INT = Pattern.compile("^[+-]?\\d+(\\.0+)?$");
    private static final Set<String> MISSING_MARKERS = Set.of("-", "N/A", "n/a", "NA", "null", "undefined");
    private static final Set<String> INVALID_NATIONALITIES = Set.of("Neutral", "neutral", "N/A", "n/a", "-");
    private static final List<String> NAME_QUALIFIERS = List.of("Tournament", "Championship", "Open");

    /**
     * Truncation repairs, each guarded so an already complete word is left alone.
     */
    private static final List<NameFix> NAME_FIXES = List.of(
            new NameFix("rounament", "tournament"),
            new NameFix("tournamen(?!t)", "tournament"),
            new NameFix("tourname(?!nt)", "tournament name"),
            new NameFix("champio(?!n)", "championship"),
            new NameFix("masters ser(?!ies)", "masters series"),
            new NameFix("grand sl(?!am)", "grand slam")
    );

    private final Clock clock;

    public MatchCleaner(Clock clock) {
        this.clock = clock;
    }

    public MatchCleaner() {
        this(Clock.systemUTC());
    }

    public Match clean(RawMatch raw) {
        return clean(raw, CleaningOptions.defaults());
    }

    public Match clean(RawMatch raw, CleaningOptions options) {
        RawMatch source = raw != null ? raw : RawMatch.empty();
        CleaningOptions opts = options != null ? options : CleaningOptions.defaults();

        String round = blankToNull(source.round());
        if (round == null && opts.fillMissingData()) round = DEFAULT_ROUND;

        Integer duration = NumericFields.parseInt(source.duration());

        return new Match(
                blankToNull(source.id()) != null ? source.id().trim() : generateId(),
                cleanTournament(source.tournament(), opts),
                round,
                Vocabulary.status(source.status()),
                cleanPlayers(source.players(), opts),
                cleanScore(source.score(), opts),
                Timestamps.normalize(source.startTime()),
                Timestamps.normalize(source.endTime()),
                blankToNull(source.court()),
                duration != null && duration >= 0 ? duration : null,
                cleanIndicators(source.liveIndicators())
        );
    }

    public List<Match> cleanAll(List<RawMatch> raws, CleaningOptions options) {
        if (raws == null) return List.of();
        return raws.stream().map(r -> clean(r, options)).toList();
    }

    // ============ TOURNAMENT ============

    Tournament cleanTournament(RawTournament raw, CleaningOptions opts) {
        if (raw == null) {
            return new Tournament(Tournament.UNKNOWN_ID, Tournament.UNKNOWN_NAME, TournamentCategory.UNKNOWN,
                    Surface.HARD, opts.defaultLocation(), null, null, null, null, null);
        }

        String name = cleanTournamentName(raw.name());
        TournamentCategory category = Vocabulary.category(raw.category());
        String level = blankToNull(raw.level());
        if (level == null) level = TournamentLevels.inferLevel(category, name);

        return new Tournament(
                blankToNull(raw.id()) != null ? raw.id().trim() : Tournament.UNKNOWN_ID,
                name,
                category,
                Vocabulary.surface(raw.surface()),
                cleanLocation(raw, opts.defaultLocation()),
                blankToNull(raw.city()),
                blankToNull(raw.country()),
                Timestamps.normalize(raw.startDate()),
                Timestamps.normalize(raw.endDate()),
                level
        );
    }

    /**
     * City and country win over the location string; a location string that is a
     * separator artifact falls back, and a trailing surface annotation is removed.
     */
    String cleanLocation(RawTournament raw, String fallback) {
        String city = blankToNull(raw.city());
        String country = blankToNull(raw.country());
        if (city != null && country != null) return city + ", " + country;
        if (city != null) return city;
        if (country != null) return country;

        String location = raw.location() == null ? "" : raw.location().trim();
        if (location.isEmpty() || location.startsWith(",") || location.startsWith("•")) {
            return fallback;
        }

        String stripped = SURFACE_SUFFIX.matcher(location).replaceFirst("").trim();
        return stripped.isEmpty() ? fallback : stripped;
    }

    String cleanTournamentName(String raw) {
        if (raw == null || raw.isBlank()) return Tournament.UNKNOWN_NAME;

        String name = raw;
        for (NameFix fix : NAME_FIXES) {
            name = fix.apply(name);
        }

        if (looksTruncated(name) && NAME_QUALIFIERS.stream().noneMatch(name::contains)) {
            name = name.trim() + " Tournament";
        }
        return name.trim();
    }

    private static boolean looksTruncated(String name) {
        if (name.length() < 5) return true;
        char last = name.charAt(name.length() - 1);
        return Character.isWhitespace(last) || Character.isLowerCase(last);
    }

    // ============ PLAYERS ============

    List<Player> cleanPlayers(List<RawPlayer> raws, CleaningOptions opts) {
        if (raws == null || raws.size() != 2) {
            if (raws != null && !raws.isEmpty()) {
                log.debug("Expected 2 players, got {}; using placeholders", raws.size());
            }
            return List.of(Player.placeholder(1), Player.placeholder(2));
        }
        List<Player> players = new ArrayList<>(2);
        for (int i = 0; i < 2; i++) {
            RawPlayer raw = raws.get(i);
            players.add(raw == null ? Player.placeholder(i + 1) : cleanPlayer(raw, i + 1, opts));
        }
        return players;
    }

    Player cleanPlayer(RawPlayer raw, int playerNumber, CleaningOptions opts) {
        String nationality = cleanNationality(raw);
        Integer ranking = NumericFields.parseInt(raw.ranking());

        return new Player(
                blankToNull(raw.id()) != null ? raw.id().trim() : "player-" + playerNumber,
                cleanPlayerName(raw.name(), playerNumber, opts.normalizeNames()),
                nationality,
                cleanCountryCode(raw, nationality),
                blankToNull(raw.abbreviation()),
                ranking != null && ranking > 0 ? ranking : null,
                positive(NumericFields.parseInt(raw.age())),
                positive(NumericFields.parseInt(raw.height())),
                positive(NumericFields.parseInt(raw.weight())),
                Vocabulary.handedness(raw.handedness()),
                positive(NumericFields.parseInt(raw.seedNumber()))
        );
    }

    String cleanPlayerName(String raw, int playerNumber, boolean normalizeNames) {
        String name = PlayerNames.stripArtifacts(raw);
        if (PlayerNames.isPlaceholder(name)) return "Player " + playerNumber;
        return normalizeNames ? PlayerNames.reorderLastFirst(name) : name;
    }

    String cleanNationality(RawPlayer raw) {
        String nationality = blankToNull(raw.nationality());
        if (nationality == null) nationality = blankToNull(raw.country());
        if (nationality == null
                || INVALID_NATIONALITIES.contains(nationality.trim())
                || CountryCodes.containsFlagArtifact(nationality)) {
            return UNKNOWN_NATIONALITY;
        }
        return nationality.trim();
    }

    /**
     * Supplied code when canonical (IOC codes are mapped), otherwise inferred from the
     * nationality, otherwise the unknown sentinel.
     */
    String cleanCountryCode(RawPlayer raw, String nationality) {
        String code = blankToNull(raw.countryCode());
        if (code == null) code = blankToNull(raw.altCountryCode());

        if (code != null && !CountryCodes.isInvalidSentinel(code)) {
            String upper = code.trim().toUpperCase(Locale.ROOT);
            if (CountryCodes.isCanonical(upper)) return upper;
            if (upper.length() == 3) {
                String mapped = CountryCodes.fromIoc(upper);
                if (!Player.UNKNOWN_COUNTRY_CODE.equals(mapped)) return mapped;
            }
        }

        return CountryCodes.fromCountryName(nationality)
                .filter(CountryCodes::isCanonical)
                .orElse(Player.UNKNOWN_COUNTRY_CODE);
    }

    // ============ SCORE ============

    Score cleanScore(RawScore raw, CleaningOptions opts) {
        if (raw == null) return null;

        List<SetScore> sets = new ArrayList<>();
        if (raw.sets() != null) {
            for (RawSet set : raw.sets()) {
                SetScore cleaned = cleanSet(set, opts.validateScores());
                if (cleaned == null) continue;
                if (sets.size() == Score.MAX_SETS) {
                    log.debug("Discarding set beyond {}: {}", Score.MAX_SETS, cleaned);
                    continue;
                }
                sets.add(cleaned);
            }
        }

        GamePair games = cleanGames(raw.games(), opts.validateScores());
        GamePair currentSet = cleanGames(raw.currentSet(), opts.validateScores());

        if (sets.isEmpty() && games == null) return null;
        return new Score(sets, games, currentSet);
    }

    SetScore cleanSet(RawSet raw, boolean strict) {
        if (raw == null) return null;
        Integer p1 = parseGames(raw.player1(), strict);
        Integer p2 = parseGames(raw.player2(), strict);
        if (p1 == null && p2 == null) return null;

        GamePair tiebreak = null;
        if (raw.tiebreak() != null) {
            Integer t1 = parseGames(raw.tiebreak().player1(), strict);
            Integer t2 = parseGames(raw.tiebreak().player2(), strict);
            if (t1 != null || t2 != null) {
                tiebreak = new GamePair(t1 != null ? t1 : 0, t2 != null ? t2 : 0);
            }
        }
        return new SetScore(p1 != null ? p1 : 0, p2 != null ? p2 : 0, tiebreak);
    }

    GamePair cleanGames(RawGames raw, boolean strict) {
        if (raw == null) return null;
        Integer p1 = parseGames(raw.player1(), strict);
        Integer p2 = parseGames(raw.player2(), strict);
        if (p1 == null && p2 == null) return null;
        return new GamePair(p1 != null ? p1 : 0, p2 != null ? p2 : 0);
    }

    /**
     * Null for blank, missing-value markers and non-numeric text. Strict parsing takes
     * whole numbers only ("6" or "6.0"); lenient parsing takes a leading integer.
     */
    static Integer parseGames(String value, boolean strict) {
        if (value == null) return null;
        String text = value.trim();
        if (text.isEmpty() || MISSING_MARKERS.contains(text)) return null;
        if (strict && !STRICT_INT.matcher(text).matches()) return null;
        return NumericFields.parseInt(text);
    }

    // ============ INDICATORS ============

    LiveIndicators cleanIndicators(RawLiveIndicators raw) {
        if (raw == null) return LiveIndicators.none();
        Integer serving = NumericFields.parseInt(raw.serving());
        return new LiveIndicators(
                serving != null && (serving == 1 || serving == 2) ? serving : null,
                Boolean.TRUE.equals(raw.setPoint()),
                Boolean.TRUE.equals(raw.matchPoint()),
                Boolean.TRUE.equals(raw.breakPoint())
        );
    }

    // ============ HELPERS ============

    private String generateId() {
        return "match-" + clock.millis() + "-" + Integer.toString(ThreadLocalRandom.current().nextInt(1 << 30), 36);
    }

    private static Integer positive(Integer value) {
        return value != null && value > 0 ? value : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record NameFix(Pattern pattern, String replacement) {
        NameFix(String regex, String replacement) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }

        /**
         * Keeps an initial capital of the broken text.
         */
        String apply(String name) {
            return pattern.matcher(name).replaceAll(m -> Character.isUpperCase(m.group().charAt(0))
                    ? Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1)
                    : replacement);
        }
    }
}
