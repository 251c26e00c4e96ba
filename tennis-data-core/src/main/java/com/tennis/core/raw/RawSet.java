package com.tennis.core.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One set as supplied by a source; each side may be a number, a numeric string or a
 * missing-value marker such as {@code "-"}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawSet(String player1, String player2, RawGames tiebreak) {

    public static RawSet of(String player1, String player2) {
        return new RawSet(player1, player2, null);
    }
}
