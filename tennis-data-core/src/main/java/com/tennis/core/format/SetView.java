package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tennis.core.model.GamePair;

/**
 * One set with its winner index (0 or 1), null while level.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetView(int player1, int player2, GamePair tiebreak, Integer winner) {
}
