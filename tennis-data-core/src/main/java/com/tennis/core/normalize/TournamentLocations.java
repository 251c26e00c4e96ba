package com.tennis.core.normalize;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Location lookup for tournaments whose source carries no city or country, keyed by
 * well-known tournament names and host cities.
 */
public final class TournamentLocations {

    public record TournamentLocation(String city, String country) {
    }

    private record KnownVenue(String keyword, String city, String country) {
    }

    private static final Pattern ATP_NAME = Pattern.compile("ATP\\s+([^,]+),\\s+(.+?)\\s+Men");
    private static final Pattern WTA_NAME = Pattern.compile("WTA\\s+([^,]+),\\s+(.+?)\\s+Women");

    // Grand Slams first so "Paris" doesn't shadow Roland Garros.
    private static final List<KnownVenue> KNOWN_VENUES = List.of(
            new KnownVenue("Australian Open", "Melbourne", "Australia"),
            new KnownVenue("Roland Garros", "Paris", "France"),
            new KnownVenue("French Open", "Paris", "France"),
            new KnownVenue("Wimbledon", "London", "United Kingdom"),
            new KnownVenue("US Open", "New York", "United States"),
            new KnownVenue("Indian Wells", "Indian Wells", "United States"),
            new KnownVenue("Miami", "Miami", "United States"),
            new KnownVenue("Monte Carlo", "Monte Carlo", "Monaco"),
            new KnownVenue("Madrid", "Madrid", "Spain"),
            new KnownVenue("Rome", "Rome", "Italy"),
            new KnownVenue("Canadian", null, "Canada"),
            new KnownVenue("Cincinnati", "Cincinnati", "United States"),
            new KnownVenue("Shanghai", "Shanghai", "China"),
            new KnownVenue("Paris", "Paris", "France"),
            new KnownVenue("Brisbane", "Brisbane", "Australia"),
            new KnownVenue("Adelaide", "Adelaide", "Australia"),
            new KnownVenue("Auckland", "Auckland", "New Zealand"),
            new KnownVenue("Buenos Aires", "Buenos Aires", "Argentina"),
            new KnownVenue("Rotterdam", "Rotterdam", "Netherlands"),
            new KnownVenue("Dubai", "Dubai", "UAE"),
            new KnownVenue("Acapulco", "Acapulco", "Mexico"),
            new KnownVenue("Barcelona", "Barcelona", "Spain"),
            new KnownVenue("Munich", "Munich", "Germany"),
            new KnownVenue("Stuttgart", "Stuttgart", "Germany"),
            new KnownVenue("Hamburg", "Hamburg", "Germany"),
            new KnownVenue("Halle", "Halle", "Germany"),
            new KnownVenue("Queen", "London", "United Kingdom"),
            new KnownVenue("Eastbourne", "Eastbourne", "United Kingdom"),
            new KnownVenue("Atlanta", "Atlanta", "United States"),
            new KnownVenue("Washington", "Washington", "United States"),
            new KnownVenue("Winston-Salem", "Winston-Salem", "United States"),
            new KnownVenue("Tokyo", "Tokyo", "Japan"),
            new KnownVenue("Beijing", "Beijing", "China"),
            new KnownVenue("Stockholm", "Stockholm", "Sweden"),
            new KnownVenue("Vienna", "Vienna", "Austria"),
            new KnownVenue("Basel", "Basel", "Switzerland"),
            new KnownVenue("Chengdu", "Chengdu", "China"),
            new KnownVenue("Doha", "Doha", "Qatar"),
            new KnownVenue("Turin", "Turin", "Italy")
    );

    private TournamentLocations() {
    }

    /**
     * Resolves a location from a tournament name: "ATP City, Country Men ..." style
     * names first, then known venues.
     */
    public static Optional<TournamentLocation> fromTournamentName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String cleanName = name.trim();

        Optional<TournamentLocation> fromPattern = matchPattern(ATP_NAME, cleanName)
                .or(() -> matchPattern(WTA_NAME, cleanName));
        if (fromPattern.isPresent()) return fromPattern;

        return KNOWN_VENUES.stream()
                .filter(v -> cleanName.contains(v.keyword()))
                .findFirst()
                .map(v -> new TournamentLocation(v.city(), v.country()));
    }

    private static Optional<TournamentLocation> matchPattern(Pattern pattern, String name) {
        Matcher m = pattern.matcher(name);
        if (!m.find()) return Optional.empty();
        return Optional.of(new TournamentLocation(m.group(1).trim(), m.group(2).trim()));
    }
}
