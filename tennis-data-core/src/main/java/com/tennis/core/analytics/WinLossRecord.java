package com.tennis.core.analytics;

/**
 * Wins and losses with the win percentage rounded to two decimals.
 */
public record WinLossRecord(int wins, int losses, int total, double winPercentage) {

    public static WinLossRecord of(int wins, int losses) {
        return new WinLossRecord(wins, losses, wins + losses, percentage(wins, wins + losses));
    }

    static double percentage(int part, int whole) {
        if (whole == 0) return 0.0;
        return Math.round(part * 10000.0 / whole) / 100.0;
    }
}
