package com.tennis.api.dto;

import com.tennis.core.analytics.MatchInsights;
import com.tennis.core.analytics.ServeProfile;
import com.tennis.core.analytics.TierRecord;
import com.tennis.core.analytics.WinLossRecord;

import java.util.List;
import java.util.Map;

/**
 * Analytics over a player's matches in the requested seasons.
 *
 * @param recentMatches serve and break metrics of the latest matches, most recent first
 */
public record PerformanceReport(
        String playerId,
        String name,
        List<Integer> seasons,
        WinLossRecord record,
        Map<String, WinLossRecord> surfaces,
        List<TierRecord> tiers,
        ServeProfile serve,
        List<MatchInsights> recentMatches
) {
}
