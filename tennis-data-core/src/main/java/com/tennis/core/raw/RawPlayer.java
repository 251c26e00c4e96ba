package com.tennis.core.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Player as supplied by a source. {@code country_code} is an alternative spelling some
 * feeds use for the country code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawPlayer(
        String id,
        String name,
        String nationality,
        String country,
        String countryCode,
        @JsonProperty("country_code") String altCountryCode,
        String abbreviation,
        String ranking,
        String age,
        String height,
        String weight,
        String handedness,
        String seedNumber
) {
    public static RawPlayer named(String name, String nationality, String countryCode) {
        return new RawPlayer(null, name, nationality, null, countryCode, null,
                null, null, null, null, null, null, null);
    }
}
