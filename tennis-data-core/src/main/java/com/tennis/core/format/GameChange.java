package com.tennis.core.format;

public record GameChange(int player1, int player2) {
}
