package com.tennis.core.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawTournament(
        String id,
        String name,
        String category,
        String surface,
        String location,
        String city,
        String country,
        String startDate,
        String endDate,
        String level
) {
}
