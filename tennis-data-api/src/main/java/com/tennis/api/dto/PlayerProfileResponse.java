package com.tennis.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tennis.core.analytics.TierRecord;
import com.tennis.core.analytics.WinLossRecord;
import com.tennis.core.model.Handedness;

import java.util.List;
import java.util.Map;

/**
 * Player profile: registry details, ranking history highlights and recent-seasons record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerProfileResponse(
        String id,
        String name,
        String abbreviation,
        String nationality,
        String countryCode,
        Handedness handedness,
        String dateOfBirth,
        Integer age,
        Integer height,
        Integer currentRanking,
        Integer currentPoints,
        Integer highestRanking,
        String highestRankingDate,
        WinLossRecord careerRecord,
        Map<String, WinLossRecord> surfacePerformance,
        List<TierRecord> tierPerformance,
        int totalTitles
) {
}
