package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Canonical tournament. Dates are ISO-8601 instants as text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tournament(
        String id,
        String name,
        TournamentCategory category,
        Surface surface,
        String location,
        String city,
        String country,
        String startDate,
        String endDate,
        String level
) {
    public static final String UNKNOWN_ID = "unknown-tournament";
    public static final String UNKNOWN_NAME = "Unknown Tournament";
}
