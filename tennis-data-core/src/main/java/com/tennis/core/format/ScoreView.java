package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tennis.core.model.GamePair;

import java.util.List;

/**
 * Sets with winners, sets won per player, in-progress games and the match winner
 * index when decided.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreView(List<SetView> sets, GamePair setsWon, GamePair currentGames, Integer matchWinner) {
}
