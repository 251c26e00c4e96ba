package com.tennis.core.cleaner;

/**
 * Switches for {@link MatchCleaner}.
 *
 * @param fillMissingData fill optional descriptive fields (round label) with defaults
 * @param validateScores  parse set sides strictly; off takes sets as supplied
 * @param normalizeNames  reorder "Last, First" player names
 * @param defaultLocation location used when a source location is missing or malformed
 */
public record CleaningOptions(
        boolean fillMissingData,
        boolean validateScores,
        boolean normalizeNames,
        String defaultLocation
) {
    public static final String UNKNOWN_LOCATION = "Unknown Location";

    public CleaningOptions {
        if (defaultLocation == null || defaultLocation.isBlank()) {
            defaultLocation = UNKNOWN_LOCATION;
        }
    }

    public static CleaningOptions defaults() {
        return new CleaningOptions(true, true, true, UNKNOWN_LOCATION);
    }

    public CleaningOptions withDefaultLocation(String location) {
        return new CleaningOptions(fillMissingData, validateScores, normalizeNames, location);
    }
}
