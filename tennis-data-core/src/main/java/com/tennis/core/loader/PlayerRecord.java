package com.tennis.core.loader;

import com.tennis.core.normalize.PlayerNames;

import java.util.Map;

/**
 * Player registry row.
 */
public record PlayerRecord(
        String playerId,
        String firstName,
        String lastName,
        String hand,
        String dateOfBirth,
        String ioc,
        String height,
        String wikidataId
) {
    public static PlayerRecord from(Map<String, String> row) {
        return new PlayerRecord(
                row.get("player_id"),
                row.getOrDefault("name_first", ""),
                row.getOrDefault("name_last", ""),
                row.get("hand"),
                row.get("dob"),
                row.get("ioc"),
                row.get("height"),
                row.get("wikidata_id")
        );
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }

    public String abbreviation() {
        return PlayerNames.abbreviation(firstName, lastName);
    }
}
