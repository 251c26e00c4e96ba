package com.tennis.core.normalize;

import com.tennis.core.model.TournamentCategory;

import java.util.Locale;
import java.util.Map;

/**
 * Tournament tier names, category derivation and prestige ordering.
 */
public final class TournamentLevels {

    public static final String GRAND_SLAM = "Grand Slam";
    public static final String MASTERS_1000 = "Masters 1000";

    /**
     * Archive level codes to display names.
     */
    private static final Map<String, String> LEVEL_NAMES = Map.of(
            "G", GRAND_SLAM,
            "M", MASTERS_1000,
            "A", "ATP 250/500",
            "250", "ATP 250",
            "500", "ATP 500",
            "F", "Tour Finals",
            "C", "Challenger",
            "S", "ITF",
            "D", "Davis Cup",
            "O", "Olympics"
    );

    private static final Map<String, Integer> LEVEL_ORDER = Map.of(
            "G", 1,
            "M", 2,
            "F", 3,
            "A", 4,
            "C", 5,
            "D", 6
    );

    private TournamentLevels() {
    }

    /**
     * Display name for an archive level code; unknown codes are returned as-is.
     */
    public static String levelName(String code) {
        if (code == null || code.isBlank()) return "Unknown";
        return LEVEL_NAMES.getOrDefault(code.trim(), code.trim());
    }

    /**
     * Prestige rank for sorting, lower first.
     */
    public static int levelOrder(String code) {
        if (code == null) return 7;
        return LEVEL_ORDER.getOrDefault(code.trim(), 7);
    }

    /**
     * Category of an archive tournament from its level code and name.
     */
    public static TournamentCategory categoryForLevel(String code, String name) {
        String level = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        String lowerName = name == null ? "" : name.toLowerCase(Locale.ROOT);

        if (level.equals("C") || lowerName.contains("challenger")) return TournamentCategory.CHALLENGER;
        if (level.equals("S") || lowerName.contains("itf")) return TournamentCategory.ITF;
        if (lowerName.contains("wta")) return TournamentCategory.WTA;
        return TournamentCategory.ATP;
    }

    /**
     * Infers a tier for a live-feed tournament that arrives without one.
     * Returns null when nothing in the name gives it away.
     */
    public static String inferLevel(TournamentCategory category, String name) {
        if (category == null || category == TournamentCategory.UNKNOWN || name == null) return null;
        String lowerName = name.toLowerCase(Locale.ROOT);

        if (lowerName.contains("grand slam")
                || lowerName.contains("wimbledon")
                || lowerName.contains("us open")
                || lowerName.contains("french open")
                || lowerName.contains("roland garros")
                || lowerName.contains("australian open")) {
            return GRAND_SLAM;
        }

        if (category == TournamentCategory.ATP) {
            if (lowerName.contains("masters") || lowerName.contains("1000")) return MASTERS_1000;
            if (lowerName.contains("500")) return "ATP 500";
            if (lowerName.contains("250")) return "ATP 250";
        }

        if (category == TournamentCategory.WTA) {
            if (lowerName.contains("1000")) return "WTA 1000";
            if (lowerName.contains("500")) return "WTA 500";
            if (lowerName.contains("250")) return "WTA 250";
        }

        return null;
    }
}
