package com.tennis.api.dto;

import java.util.List;

public record RankingsResponse(
        String tour,
        String rankingDate,
        Integer year,
        int total,
        List<RankingEntry> rankings
) {
}
