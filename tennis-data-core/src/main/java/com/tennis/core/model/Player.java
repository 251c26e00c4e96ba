package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Canonical player. Name and country code are always populated after cleaning.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Player(
        String id,
        String name,
        String nationality,
        String countryCode,
        String abbreviation,
        Integer ranking,
        Integer age,
        Integer height,
        Integer weight,
        Handedness handedness,
        Integer seedNumber
) {
    public static final String UNKNOWN_COUNTRY_CODE = "XX";
    public static final String NEUTRAL_COUNTRY_CODE = "UN";

    /**
     * Placeholder used when the source supplies fewer than two players.
     */
    public static Player placeholder(int playerNumber) {
        return new Player("player-" + playerNumber, "Player " + playerNumber, "Unknown",
                UNKNOWN_COUNTRY_CODE, null, null, null, null, null, null, null);
    }
}
