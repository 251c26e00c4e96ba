package com.tennis.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tennis.core.cache.CacheStats;
import com.tennis.core.cache.TtlCache;
import com.tennis.core.model.GamePair;
import com.tennis.core.model.LiveUpdate;
import com.tennis.core.model.Match;
import com.tennis.core.model.MatchStatus;
import com.tennis.core.model.Player;
import com.tennis.core.model.Score;
import com.tennis.core.model.SetScore;
import com.tennis.core.model.Tournament;
import com.tennis.core.normalize.CountryCodes;
import com.tennis.core.normalize.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks canonical matches and live updates against the rules of tennis scoring and
 * the match lifecycle. Match results are cached by the full serialized match, so any
 * field change is validated afresh.
 */
public class MatchValidator {

    private static final Logger log = LoggerFactory.getLogger(MatchValidator.class);

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    private static final int MAX_CURRENT_GAMES = 7;

    private final TtlCache<String, ValidationResult> cache;
    private final ObjectMapper objectMapper;

    public MatchValidator(Duration cacheTtl, Clock clock, ObjectMapper objectMapper) {
        this.cache = new TtlCache<>(cacheTtl, clock);
        this.objectMapper = objectMapper;
    }

    public MatchValidator(ObjectMapper objectMapper) {
        this(DEFAULT_CACHE_TTL, Clock.systemUTC(), objectMapper);
    }

    // ============ MATCH VALIDATION ============

    public ValidationResult validate(Match match) {
        if (match == null) {
            return ValidationResult.of(List.of("Match data is required"), List.of());
        }

        String fingerprint = fingerprint(match);
        if (fingerprint == null) {
            return runRules(match);
        }
        return cache.getOrCompute(fingerprint, () -> runRules(match));
    }

    private ValidationResult runRules(Match match) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (match.id() == null || match.id().isBlank()) errors.add("Match ID is required");
        if (match.status() == null) errors.add("Match status is required");

        checkTournament(match.tournament(), errors, warnings);

        if (match.players().size() != 2) {
            errors.add("Match must have exactly 2 players");
        }
        for (int i = 0; i < match.players().size(); i++) {
            checkPlayer(match.players().get(i), i + 1, errors, warnings);
        }

        if (match.score() != null) {
            checkScore(match.score(), match.status(), errors, warnings);
        }
        checkStatusConsistency(match, warnings);
        checkTimes(match, errors, warnings);

        ValidationResult result = ValidationResult.of(errors, warnings);
        if (!result.valid()) {
            log.debug("Match {} failed validation: {}", match.id(), result.errors());
        }
        return result;
    }

    private void checkTournament(Tournament tournament, List<String> errors, List<String> warnings) {
        if (tournament == null) {
            errors.add("Tournament information is required");
            return;
        }
        if (tournament.name() == null || tournament.name().isBlank()) errors.add("Tournament name is required");
        if (tournament.category() == null) warnings.add("Tournament category is missing");
        if (tournament.surface() == null) warnings.add("Tournament surface is missing");
        if (tournament.location() == null || tournament.location().isBlank()) {
            warnings.add("Tournament location is missing");
        }
    }

    private void checkPlayer(Player player, int number, List<String> errors, List<String> warnings) {
        String label = "Player " + number;
        if (player == null) {
            errors.add(label + " is missing");
            return;
        }
        if (player.name() == null || player.name().isBlank()) errors.add(label + " name is required");
        if (player.nationality() == null || player.nationality().isBlank()) {
            warnings.add(label + " nationality is missing");
        }
        if (player.countryCode() == null || player.countryCode().isBlank()) {
            warnings.add(label + " country code is missing");
        } else if (!CountryCodes.isCanonical(player.countryCode())) {
            warnings.add(label + " has invalid country code: " + player.countryCode());
        }
        if (player.ranking() != null && player.ranking() < 1) {
            warnings.add(label + " has invalid ranking: " + player.ranking());
        }
    }

    private void checkScore(Score score, MatchStatus status, List<String> errors, List<String> warnings) {
        List<SetScore> sets = score.sets();
        if (sets.size() > Score.MAX_SETS) {
            errors.add("Match cannot have more than " + Score.MAX_SETS + " sets");
        }
        for (int i = 0; i < sets.size(); i++) {
            checkSet(sets.get(i), i + 1, errors, warnings);
        }

        GamePair games = score.games();
        if (games != null) {
            if (games.player1() < 0 || games.player2() < 0) {
                errors.add("Current games cannot be negative");
            } else if (games.max() > MAX_CURRENT_GAMES) {
                warnings.add("Current games unusually high: " + games);
            }
        }

        if (status == MatchStatus.COMPLETED && !sets.isEmpty()) {
            checkCompletion(score, warnings);
        }
    }

    /**
     * Game rules for one set: six games with a two-game margin, 7-5, 7-6 via tiebreak,
     * or an advantage set won by exactly two.
     */
    private void checkSet(SetScore set, int number, List<String> errors, List<String> warnings) {
        String label = "Set " + number;
        if (set.player1() < 0 || set.player2() < 0) {
            errors.add(label + ": game counts cannot be negative");
            return;
        }

        int winner = Math.max(set.player1(), set.player2());
        int loser = Math.min(set.player1(), set.player2());

        if (winner < 6 && winner - loser > 2) {
            warnings.add(label + ": unusual score " + set.player1() + "-" + set.player2() + " (set not finished)");
        } else if (winner == 6 && loser > 4) {
            warnings.add(label + ": score " + set.player1() + "-" + set.player2() + " needs more games");
        } else if (winner == 7) {
            if (loser < 5) {
                errors.add(label + ": invalid score " + set.player1() + "-" + set.player2());
            } else if (loser == 6 && set.tiebreak() == null) {
                warnings.add(label + ": missing tiebreak score");
            }
        } else if (winner > 7 && winner - loser != 2) {
            errors.add(label + ": invalid extended set score " + set.player1() + "-" + set.player2());
        }

        if (set.tiebreak() != null) {
            checkTiebreak(set.tiebreak(), label, errors, warnings);
        }
    }

    private void checkTiebreak(GamePair tiebreak, String label, List<String> errors, List<String> warnings) {
        if (tiebreak.player1() < 0 || tiebreak.player2() < 0) {
            errors.add(label + ": tiebreak points cannot be negative");
            return;
        }
        int max = tiebreak.max();
        int margin = max - tiebreak.min();
        if (max < 7 && margin != 0) {
            warnings.add(label + ": tiebreak " + tiebreak + " is incomplete");
        } else if (max >= 7 && margin < 2) {
            warnings.add(label + ": tiebreak " + tiebreak + " should continue");
        }
    }

    private void checkCompletion(Score score, List<String> warnings) {
        GamePair setsWon = score.setsWon();
        int winnerSets = setsWon.max();
        int decided = setsWon.player1() + setsWon.player2();

        if (winnerSets < 2) {
            warnings.add("Completed match has no player with at least 2 sets");
        }
        if (decided < 2) {
            warnings.add("Completed match should have at least 2 decided sets");
        }
        boolean bestOfThree = winnerSets == 2 && decided <= 3;
        boolean bestOfFive = winnerSets == 3 && decided <= 5;
        if (!bestOfThree && !bestOfFive) {
            warnings.add("Completed match set count " + setsWon + " does not fit best of 3 or best of 5");
        }
    }

    private void checkStatusConsistency(Match match, List<String> warnings) {
        boolean hasSets = match.score() != null && !match.score().sets().isEmpty();
        if (match.status() == MatchStatus.SCHEDULED && hasSets) {
            warnings.add("Scheduled match has set scores");
        }
        if ((match.status() == MatchStatus.COMPLETED || match.status() == MatchStatus.LIVE) && !hasSets) {
            warnings.add(match.status().getValue() + " match has no set scores");
        }
    }

    private void checkTimes(Match match, List<String> errors, List<String> warnings) {
        Optional<Instant> start = Optional.empty();
        Optional<Instant> end = Optional.empty();

        if (match.startTime() != null) {
            start = Timestamps.parse(match.startTime());
            if (start.isEmpty()) warnings.add("Invalid start time format: " + match.startTime());
        }
        if (match.endTime() != null) {
            end = Timestamps.parse(match.endTime());
            if (end.isEmpty()) warnings.add("Invalid end time format: " + match.endTime());
        }
        if (start.isPresent() && end.isPresent() && !end.get().isAfter(start.get())) {
            errors.add("End time must be after start time");
        }
    }

    // ============ LIVE UPDATES ============

    /**
     * Checks an update against the last known state: the timestamp must be readable,
     * scores may only move forward and the status may only follow the lifecycle.
     */
    public ValidationResult validateLiveUpdate(Match previous, LiveUpdate update) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (update == null) {
            return ValidationResult.of(List.of("Live update is required"), List.of());
        }
        if (Timestamps.parse(update.timestamp()).isEmpty()) {
            errors.add("Invalid update timestamp: " + update.timestamp());
        }

        if (previous != null) {
            // status-only pings carry no score
            if (previous.score() != null && update.score() != null) {
                checkScoreProgression(previous.score(), update.score(), errors, warnings);
            }
            checkTransition(previous.status(), update.status(), errors);
        }

        return ValidationResult.of(errors, warnings);
    }

    private void checkScoreProgression(Score before, Score after, List<String> errors, List<String> warnings) {
        List<SetScore> oldSets = before.sets();
        List<SetScore> newSets = after.sets();

        if (newSets.size() < oldSets.size()) {
            errors.add("Set count decreased from " + oldSets.size() + " to " + newSets.size());
        }

        for (int i = 0; i < oldSets.size(); i++) {
            if (i >= newSets.size()) {
                errors.add("Set " + (i + 1) + " disappeared from score");
                continue;
            }
            SetScore was = oldSets.get(i);
            SetScore now = newSets.get(i);
            if (now.player1() < was.player1() || now.player2() < was.player2()) {
                errors.add("Set " + (i + 1) + " games decreased from " + was.player1() + "-" + was.player2()
                        + " to " + now.player1() + "-" + now.player2());
            }
        }

        GamePair oldGames = before.games();
        GamePair newGames = after.games();
        if (oldGames != null && newGames != null && newSets.size() == oldSets.size()
                && (newGames.player1() < oldGames.player1() || newGames.player2() < oldGames.player2())) {
            warnings.add("Current games decreased from " + oldGames + " to " + newGames + " without a new set");
        }
    }

    private void checkTransition(MatchStatus from, MatchStatus to, List<String> errors) {
        if (from == null || to == null || from == to) return;
        if (!from.allowedTransitions().contains(to)) {
            errors.add("Invalid status transition from " + from.getValue() + " to " + to.getValue());
        }
    }

    // ============ CACHE ============

    public void clearCache() {
        cache.clear();
        log.info("Validation cache cleared");
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    private String fingerprint(Match match) {
        try {
            return objectMapper.writeValueAsString(match);
        } catch (JsonProcessingException e) {
            log.warn("Could not fingerprint match {} for caching: {}", match.id(), e.getMessage());
            return null;
        }
    }
}
