package com.tennis.core.normalize;

/**
 * Name-format heuristics for player names coming from inconsistent feeds.
 */
public final class PlayerNames {

    private static final String LAST_FIRST_SEPARATOR = ", ";

    private PlayerNames() {
    }

    /**
     * Blank, null or a bare dash.
     */
    public static boolean isPlaceholder(String name) {
        return name == null || name.isBlank() || name.trim().equals("-");
    }

    /**
     * Removes flag emoji and replacement characters, collapsing the whitespace they leave.
     */
    public static String stripArtifacts(String name) {
        if (name == null) return "";
        return CountryCodes.FLAG_ARTIFACTS.matcher(name).replaceAll("")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * "Last, First" becomes "First Last". Names carrying a Jr./Sr. suffix keep their comma.
     */
    public static String reorderLastFirst(String name) {
        if (!isLastFirst(name)) return name;
        String[] parts = name.split(LAST_FIRST_SEPARATOR);
        String last = parts[0].trim();
        String first = parts[1].trim();
        if (last.isEmpty() || first.isEmpty()) return name;
        return first + " " + last;
    }

    /**
     * Single surname token: the part before the comma of "Last, First", otherwise the
     * last whitespace-delimited word.
     */
    public static String surname(String name) {
        if (name == null || name.isBlank()) return "";
        String trimmed = name.trim();
        if (trimmed.contains(LAST_FIRST_SEPARATOR)) {
            return trimmed.split(LAST_FIRST_SEPARATOR)[0].trim();
        }
        String[] words = trimmed.split("\\s+");
        return words[words.length - 1];
    }

    /**
     * Initials of first and last name, upper-cased; null when either is missing.
     */
    public static String abbreviation(String firstName, String lastName) {
        if (firstName == null || firstName.isBlank() || lastName == null || lastName.isBlank()) {
            return null;
        }
        return ("" + firstName.trim().charAt(0) + lastName.trim().charAt(0)).toUpperCase();
    }

    private static boolean isLastFirst(String name) {
        return name != null
                && name.contains(LAST_FIRST_SEPARATOR)
                && !name.contains("Jr.")
                && !name.contains("Sr.");
    }
}
