package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Games won by each player in one set, with the tiebreak points when one was played.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetScore(int player1, int player2, GamePair tiebreak) {

    public SetScore(int player1, int player2) {
        this(player1, player2, null);
    }

    /**
     * Index of the player holding strictly more games (0 or 1), or null when level.
     */
    @JsonIgnore
    public Integer winnerIndex() {
        if (player1 > player2) return 0;
        if (player2 > player1) return 1;
        return null;
    }

    @Override
    public String toString() {
        String games = player1 + "-" + player2;
        return tiebreak != null ? games + "(" + tiebreak + ")" : games;
    }
}
