package com.tennis.core.format;

/**
 * Games gained per player in one set; {@code setIndex} is zero-based.
 */
public record SetChange(int setIndex, int player1, int player2) {
}
