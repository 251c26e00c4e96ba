package com.tennis.core.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Match snapshot as received from a source. Every field may be null or malformed;
 * scalar fields accept JSON strings and numbers alike.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawMatch(
        String id,
        RawTournament tournament,
        String round,
        String status,
        List<RawPlayer> players,
        RawScore score,
        String startTime,
        String endTime,
        String court,
        String duration,
        RawLiveIndicators liveIndicators
) {
    public static RawMatch empty() {
        return new RawMatch(null, null, null, null, null, null, null, null, null, null, null);
    }
}
