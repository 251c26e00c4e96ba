package com.tennis.core.model;

/**
 * A pair of counts, one per player (games in a set, points in a tiebreak).
 */
public record GamePair(int player1, int player2) {

    public int max() {
        return Math.max(player1, player2);
    }

    public int min() {
        return Math.min(player1, player2);
    }

    @Override
    public String toString() {
        return player1 + "-" + player2;
    }
}
