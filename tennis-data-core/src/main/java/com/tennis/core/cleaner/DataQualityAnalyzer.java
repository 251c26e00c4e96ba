package com.tennis.core.cleaner;

import com.tennis.core.normalize.CountryCodes;
import com.tennis.core.normalize.PlayerNames;
import com.tennis.core.raw.RawMatch;
import com.tennis.core.raw.RawPlayer;
import com.tennis.core.raw.RawSet;
import com.tennis.core.raw.RawTournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Surveys source matches for the defects {@link MatchCleaner} repairs.
 */
public class DataQualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DataQualityAnalyzer.class);

    private static final Pattern WHOLE_NUMBER = Pattern.compile("^\\s*\\d+\\s*$");

    public DataQualityReport analyze(List<RawMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return new DataQualityReport(0, 0, 0, 0, 0, List.of());
        }

        int locationIssues = 0;
        int scoreIssues = 0;
        int nameIssues = 0;
        int countryIssues = 0;

        for (RawMatch match : matches) {
            if (match == null) continue;
            if (hasLocationIssue(match.tournament())) locationIssues++;
            if (hasScoreIssue(match)) scoreIssues++;
            if (players(match).stream().anyMatch(DataQualityAnalyzer::hasNameIssue)) nameIssues++;
            if (players(match).stream().anyMatch(DataQualityAnalyzer::hasCountryIssue)) countryIssues++;
        }

        List<String> recommendations = new ArrayList<>();
        if (locationIssues > 0) {
            recommendations.add("Fix tournament location data: " + locationIssues
                    + " matches have malformed or missing locations");
        }
        if (scoreIssues > 0) {
            recommendations.add("Validate score data: " + scoreIssues
                    + " matches have non-numeric or missing set scores");
        }
        if (nameIssues > 0) {
            recommendations.add("Normalize player names: " + nameIssues
                    + " matches have placeholder, reversed or emoji-bearing names");
        }
        if (countryIssues > 0) {
            recommendations.add("Improve country data: " + countryIssues
                    + " matches have missing or invalid country codes");
        }

        DataQualityReport report = new DataQualityReport(matches.size(), locationIssues, scoreIssues,
                nameIssues, countryIssues, recommendations);
        log.debug("Data quality over {} matches: {} issues", matches.size(), report.totalIssues());
        return report;
    }

    static boolean hasLocationIssue(RawTournament tournament) {
        if (tournament == null) return true;
        if (notBlank(tournament.city()) || notBlank(tournament.country())) return false;
        String location = tournament.location() == null ? "" : tournament.location().trim();
        return location.isEmpty()
                || location.startsWith(",")
                || location.startsWith("•")
                || location.contains("•");
    }

    static boolean hasScoreIssue(RawMatch match) {
        if (match.score() == null || match.score().sets() == null) return false;
        for (RawSet set : match.score().sets()) {
            if (set == null || !isWholeNumber(set.player1()) || !isWholeNumber(set.player2())) {
                return true;
            }
        }
        return false;
    }

    static boolean hasNameIssue(RawPlayer player) {
        if (player == null) return true;
        String name = player.name();
        return PlayerNames.isPlaceholder(name)
                || CountryCodes.containsFlagArtifact(name)
                || name.contains(", ")
                || name.trim().toLowerCase(Locale.ROOT).matches("player \\d+");
    }

    static boolean hasCountryIssue(RawPlayer player) {
        if (player == null) return true;
        String code = notBlank(player.countryCode()) ? player.countryCode() : player.altCountryCode();
        return CountryCodes.isInvalidSentinel(code) || !CountryCodes.isCanonical(code.trim());
    }

    private static List<RawPlayer> players(RawMatch match) {
        return match.players() == null ? List.of() : match.players();
    }

    private static boolean isWholeNumber(String value) {
        return value != null && WHOLE_NUMBER.matcher(value).matches();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
