package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A player as shown in a match listing. {@code displayName} is the name in
 * "First Last" order, or the surname alone in compact views.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerView(
        String id,
        String name,
        String displayName,
        String nationality,
        String countryCode,
        Integer ranking,
        boolean serving,
        boolean winner
) {
    public PlayerView withDisplayName(String newDisplayName) {
        return new PlayerView(id, name, newDisplayName, nationality, countryCode, ranking, serving, winner);
    }
}
