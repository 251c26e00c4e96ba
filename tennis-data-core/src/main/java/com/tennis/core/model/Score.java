package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Chronologically ordered sets plus the in-progress game counts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Score(List<SetScore> sets, GamePair games, GamePair currentSet) {

    public static final int MAX_SETS = 5;

    public Score {
        sets = sets == null ? List.of() : List.copyOf(sets);
    }

    public Score(List<SetScore> sets) {
        this(sets, null, null);
    }

    /**
     * Sets won by each player, counting only decided sets.
     */
    public GamePair setsWon() {
        int p1 = 0;
        int p2 = 0;
        for (SetScore set : sets) {
            Integer winner = set.winnerIndex();
            if (winner == null) continue;
            if (winner == 0) p1++; else p2++;
        }
        return new GamePair(p1, p2);
    }
}
