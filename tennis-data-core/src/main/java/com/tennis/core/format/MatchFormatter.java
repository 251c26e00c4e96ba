package com.tennis.core.format;

import com.tennis.core.model.GamePair;
import com.tennis.core.model.LiveIndicators;
import com.tennis.core.model.Match;
import com.tennis.core.model.MatchStatus;
import com.tennis.core.model.Player;
import com.tennis.core.model.Score;
import com.tennis.core.model.SetScore;
import com.tennis.core.model.Tournament;
import com.tennis.core.normalize.PlayerNames;
import com.tennis.core.normalize.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives display views from canonical matches. Relative times are computed against
 * the injected clock, so views are not memoized.
 */
public class MatchFormatter {

    private static final String UNKNOWN_LOCATION = "Unknown Location";
    private static final DateTimeFormatter START_TIME = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private static final StatusView UNKNOWN_STATUS = new StatusView("UNKNOWN", "gray", "❓", false);
    private static final Map<MatchStatus, StatusView> STATUS_VIEWS = Map.of(
            MatchStatus.LIVE, new StatusView("LIVE", "red", "🔴", true),
            MatchStatus.COMPLETED, new StatusView("FINISHED", "green", "✅", false),
            MatchStatus.SCHEDULED, new StatusView("UPCOMING", "blue", "🕒", false),
            MatchStatus.CANCELLED, new StatusView("CANCELLED", "gray", "❌", false),
            MatchStatus.WALKOVER, new StatusView("WALKOVER", "yellow", "⚠️", false),
            MatchStatus.RETIRED, new StatusView("RETIRED", "orange", "🔄", false)
    );

    private final Clock clock;

    public MatchFormatter(Clock clock) {
        this.clock = clock;
    }

    public MatchFormatter() {
        this(Clock.systemUTC());
    }

    // ============ SINGLE MATCH ============

    public DisplayView format(Match match) {
        Integer matchWinner = matchWinner(match.score());
        LiveIndicators indicators = match.liveIndicators() != null ? match.liveIndicators() : LiveIndicators.none();

        return new DisplayView(
                match.id(),
                statusView(match.status()),
                tournamentView(match.tournament()),
                match.round(),
                playerViews(match.players(), indicators.serving(), matchWinner),
                scoreView(match.score(), matchWinner),
                timeView(match),
                new IndicatorsView(indicators.serving(), indicators.setPoint(),
                        indicators.matchPoint(), indicators.breakPoint()),
                match.court()
        );
    }

    /**
     * Same view with display names cut down to the surname.
     */
    public DisplayView formatCompact(Match match) {
        DisplayView full = format(match);
        List<PlayerView> players = full.players().stream()
                .map(p -> p.withDisplayName(PlayerNames.surname(p.name())))
                .toList();
        return full.withPlayers(players);
    }

    public StatusView statusView(MatchStatus status) {
        if (status == null) return UNKNOWN_STATUS;
        return STATUS_VIEWS.getOrDefault(status, UNKNOWN_STATUS);
    }

    private TournamentView tournamentView(Tournament tournament) {
        if (tournament == null) {
            return new TournamentView(Tournament.UNKNOWN_NAME, null, null, UNKNOWN_LOCATION, null);
        }
        return new TournamentView(
                tournament.name(),
                tournament.category() != null ? tournament.category().getLabel() : null,
                tournament.surface() != null ? tournament.surface().getLabel() : null,
                location(tournament),
                tournament.level()
        );
    }

    static String location(Tournament tournament) {
        if (notBlank(tournament.city()) && notBlank(tournament.country())) {
            return tournament.city() + ", " + tournament.country();
        }
        if (notBlank(tournament.location())) return tournament.location();
        return UNKNOWN_LOCATION;
    }

    private List<PlayerView> playerViews(List<Player> players, Integer serving, Integer matchWinner) {
        List<PlayerView> views = new ArrayList<>();
        for (int i = 0; i < players.size(); i++) {
            Player p = players.get(i);
            views.add(new PlayerView(
                    p.id(),
                    p.name(),
                    PlayerNames.reorderLastFirst(p.name()),
                    p.nationality(),
                    p.countryCode(),
                    p.ranking(),
                    serving != null && serving == i + 1,
                    matchWinner != null && matchWinner == i
            ));
        }
        return views;
    }

    // ============ SCORE ============

    private ScoreView scoreView(Score score, Integer matchWinner) {
        if (score == null) return null;
        List<SetView> sets = score.sets().stream()
                .map(s -> new SetView(s.player1(), s.player2(), s.tiebreak(), s.winnerIndex()))
                .toList();
        GamePair current = score.games() != null ? score.games() : score.currentSet();
        return new ScoreView(sets, score.setsWon(), current, matchWinner);
    }

    /**
     * 0 or 1 once a player has taken two sets of at most three decided, or three of at
     * most five; null otherwise.
     */
    public static Integer matchWinner(Score score) {
        if (score == null || score.sets().isEmpty()) return null;
        GamePair won = score.setsWon();
        int decided = won.player1() + won.player2();
        if (won.player1() == won.player2()) return null;

        int leader = Math.max(won.player1(), won.player2());
        boolean decidedMatch = (leader == 2 && decided <= 3) || (leader == 3 && decided <= 5);
        if (!decidedMatch) return null;
        return won.player1() > won.player2() ? 0 : 1;
    }

    // ============ TIME ============

    private TimeView timeView(Match match) {
        Optional<Instant> start = Timestamps.parse(match.startTime());
        return new TimeView(
                start.map(START_TIME::format).orElse(null),
                match.durationMinutes() != null ? formatDuration(match.durationMinutes()) : null,
                relativeTime(match, start)
        );
    }

    static String formatDuration(int minutes) {
        int hours = minutes / 60;
        int mins = minutes % 60;
        return hours > 0 ? hours + "h " + mins + "m" : mins + "m";
    }

    private String relativeTime(Match match, Optional<Instant> start) {
        Instant now = clock.instant();

        if (start.isPresent() && match.status() == MatchStatus.SCHEDULED) {
            long hours = roundedHours(Duration.between(now, start.get()));
            if (hours < 0) return "Should have started";
            if (hours == 0) return "Starting soon";
            if (hours < 24) return "In " + hours + "h";
            return "In " + Math.round(hours / 24.0) + "d";
        }

        Optional<Instant> end = Timestamps.parse(match.endTime());
        if (end.isPresent()) {
            long hours = roundedHours(Duration.between(end.get(), now));
            if (hours < 1) return "Just finished";
            if (hours < 24) return hours + "h ago";
            return Math.round(hours / 24.0) + "d ago";
        }

        return match.status() == MatchStatus.LIVE ? "In progress" : "Time unknown";
    }

    private static long roundedHours(Duration duration) {
        return Math.round(duration.toMillis() / 3_600_000.0);
    }

    // ============ LISTS ============

    public List<DisplayView> formatList(List<Match> matches, boolean compact) {
        return matches.stream()
                .map(m -> compact ? formatCompact(m) : format(m))
                .toList();
    }

    public MatchGroups groupByStatus(List<Match> matches, boolean compact) {
        List<DisplayView> live = new ArrayList<>();
        List<DisplayView> upcoming = new ArrayList<>();
        List<DisplayView> completed = new ArrayList<>();
        List<DisplayView> other = new ArrayList<>();

        for (Match match : matches) {
            DisplayView view = compact ? formatCompact(match) : format(match);
            MatchStatus status = match.status();
            if (status == MatchStatus.LIVE) {
                live.add(view);
            } else if (status == MatchStatus.SCHEDULED) {
                upcoming.add(view);
            } else if (status == MatchStatus.COMPLETED || status == MatchStatus.RETIRED
                    || status == MatchStatus.WALKOVER) {
                completed.add(view);
            } else {
                other.add(view);
            }
        }
        return new MatchGroups(live, upcoming, completed, other);
    }

    // ============ SCORE CHANGES ============

    /**
     * Games gained per set and in the current game count between two snapshots. Only sets
     * present in both snapshots are compared and only gains are reported; a set added since
     * the earlier snapshot shows up as the new-set flag. Empty when either score is missing.
     */
    public Optional<ScoreDelta> compareScores(Score before, Score after) {
        if (before == null || after == null) return Optional.empty();

        List<SetChange> setChanges = new ArrayList<>();
        int shared = Math.min(before.sets().size(), after.sets().size());
        for (int i = 0; i < shared; i++) {
            SetScore was = before.sets().get(i);
            SetScore now = after.sets().get(i);
            int d1 = Math.max(0, now.player1() - was.player1());
            int d2 = Math.max(0, now.player2() - was.player2());
            if (d1 > 0 || d2 > 0) {
                setChanges.add(new SetChange(i, d1, d2));
            }
        }

        GameChange gameChange = null;
        if (before.games() != null && after.games() != null) {
            int d1 = Math.max(0, after.games().player1() - before.games().player1());
            int d2 = Math.max(0, after.games().player2() - before.games().player2());
            if (d1 > 0 || d2 > 0) gameChange = new GameChange(d1, d2);
        }

        return Optional.of(new ScoreDelta(setChanges, gameChange, after.sets().size() > before.sets().size()));
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
