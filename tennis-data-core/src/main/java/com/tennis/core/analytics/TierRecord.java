package com.tennis.core.analytics;

/**
 * Record at one tournament tier; titles are finals won.
 */
public record TierRecord(String level, int wins, int losses, int total, double winPercentage, int titles) {
}
