package com.tennis.core.analytics;

public record MatchInsights(String matchKey, SideInsights winner, SideInsights loser) {
}
