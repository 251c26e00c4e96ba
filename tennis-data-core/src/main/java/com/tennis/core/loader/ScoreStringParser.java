package com.tennis.core.loader;

import com.tennis.core.model.MatchStatus;
import com.tennis.core.raw.RawGames;
import com.tennis.core.raw.RawSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads archive score strings such as {@code "6-4 7-6(5) 3-1 RET"}, oriented winner first.
 * The parenthesized number is the set loser's tiebreak points; the set winner is credited
 * {@code max(7, loser + 2)}, which is exact for seven-point tiebreaks only.
 */
public final class ScoreStringParser {

    private static final Pattern SET_TOKEN = Pattern.compile("^(\\d+)-(\\d+)(?:\\((\\d+)\\))?$");

    private ScoreStringParser() {
    }

    public record ParsedScore(List<RawSet> sets, MatchStatus outcome) {
        public ParsedScore {
            sets = List.copyOf(sets);
        }
    }

    /**
     * Unknown tokens are skipped. The outcome is completed unless a retirement, walkover
     * or default marker is present.
     */
    public static ParsedScore parse(String score) {
        List<RawSet> sets = new ArrayList<>();
        MatchStatus outcome = MatchStatus.COMPLETED;
        if (score == null || score.isBlank()) {
            return new ParsedScore(sets, outcome);
        }

        for (String token : score.trim().split("\\s+")) {
            Matcher m = SET_TOKEN.matcher(token);
            if (m.matches()) {
                sets.add(toSet(m.group(1), m.group(2), m.group(3)));
                continue;
            }

            String marker = token.toUpperCase(Locale.ROOT);
            if (marker.startsWith("RET") || marker.startsWith("DEF")) {
                outcome = MatchStatus.RETIRED;
            } else if (marker.equals("W/O") || marker.equals("WO")) {
                outcome = MatchStatus.WALKOVER;
            }
        }

        return new ParsedScore(sets, outcome);
    }

    private static RawSet toSet(String games1, String games2, String tiebreakLoserPoints) {
        if (tiebreakLoserPoints == null) {
            return RawSet.of(games1, games2);
        }
        int loserPoints = Integer.parseInt(tiebreakLoserPoints);
        String winnerPoints = String.valueOf(Math.max(7, loserPoints + 2));
        boolean player1WonSet = Integer.parseInt(games1) > Integer.parseInt(games2);
        RawGames tiebreak = player1WonSet
                ? new RawGames(winnerPoints, tiebreakLoserPoints)
                : new RawGames(tiebreakLoserPoints, winnerPoints);
        return new RawSet(games1, games2, tiebreak);
    }
}
