package com.tennis.core.normalize;

import com.tennis.core.model.Handedness;
import com.tennis.core.model.MatchStatus;
import com.tennis.core.model.Surface;
import com.tennis.core.model.TournamentCategory;

import java.util.Locale;
import java.util.Map;

/**
 * Source vocabularies for status, category, surface and handedness, each mapped onto
 * its closed canonical enum with an explicit fallback.
 */
public final class Vocabulary {

    private static final Map<String, MatchStatus> STATUSES = Map.ofEntries(
            Map.entry("ft", MatchStatus.COMPLETED),
            Map.entry("finished", MatchStatus.COMPLETED),
            Map.entry("final", MatchStatus.COMPLETED),
            Map.entry("ended", MatchStatus.COMPLETED),
            Map.entry("completed", MatchStatus.COMPLETED),
            Map.entry("closed", MatchStatus.COMPLETED),
            Map.entry("live", MatchStatus.LIVE),
            Map.entry("inprogress", MatchStatus.LIVE),
            Map.entry("in progress", MatchStatus.LIVE),
            Map.entry("in_progress", MatchStatus.LIVE),
            Map.entry("scheduled", MatchStatus.SCHEDULED),
            Map.entry("upcoming", MatchStatus.SCHEDULED),
            Map.entry("not started", MatchStatus.SCHEDULED),
            Map.entry("not_started", MatchStatus.SCHEDULED),
            Map.entry("cancelled", MatchStatus.CANCELLED),
            Map.entry("canceled", MatchStatus.CANCELLED),
            Map.entry("walkover", MatchStatus.WALKOVER),
            Map.entry("wo", MatchStatus.WALKOVER),
            Map.entry("w/o", MatchStatus.WALKOVER),
            Map.entry("retired", MatchStatus.RETIRED),
            Map.entry("ret", MatchStatus.RETIRED)
    );

    private static final Map<String, TournamentCategory> CATEGORIES = Map.of(
            "atp", TournamentCategory.ATP,
            "wta", TournamentCategory.WTA,
            "challenger", TournamentCategory.CHALLENGER,
            "itf", TournamentCategory.ITF,
            "exhibition", TournamentCategory.EXHIBITION
    );

    private static final Map<String, Surface> SURFACES = Map.of(
            "hard", Surface.HARD,
            "hardcourt", Surface.HARD,
            "hard court", Surface.HARD,
            "clay", Surface.CLAY,
            "red clay", Surface.CLAY,
            "grass", Surface.GRASS,
            "indoor", Surface.INDOOR,
            "carpet", Surface.CARPET
    );

    private Vocabulary() {
    }

    /**
     * Unrecognized or absent statuses read as scheduled.
     */
    public static MatchStatus status(String raw) {
        if (isBlank(raw)) return MatchStatus.SCHEDULED;
        return STATUSES.getOrDefault(key(raw), MatchStatus.SCHEDULED);
    }

    public static TournamentCategory category(String raw) {
        if (isBlank(raw)) return TournamentCategory.UNKNOWN;
        return CATEGORIES.getOrDefault(key(raw), TournamentCategory.UNKNOWN);
    }

    /**
     * Exact vocabulary first, then by contained keyword ("Hard (Indoor)" reads as hard);
     * hard court otherwise.
     */
    public static Surface surface(String raw) {
        if (isBlank(raw)) return Surface.HARD;
        String key = key(raw);
        Surface exact = SURFACES.get(key);
        if (exact != null) return exact;
        if (key.contains("clay")) return Surface.CLAY;
        if (key.contains("grass")) return Surface.GRASS;
        if (key.contains("carpet")) return Surface.CARPET;
        if (key.contains("hard")) return Surface.HARD;
        if (key.contains("indoor")) return Surface.INDOOR;
        return Surface.HARD;
    }

    /**
     * Null when the hand cannot be told.
     */
    public static Handedness handedness(String raw) {
        if (isBlank(raw)) return null;
        String hand = key(raw);
        if (hand.contains("left") || hand.equals("l")) return Handedness.LEFT;
        if (hand.contains("right") || hand.equals("r")) return Handedness.RIGHT;
        return null;
    }

    private static String key(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
