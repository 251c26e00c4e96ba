package com.tennis.core.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient integer reading for archive and feed fields.
 */
public final class NumericFields {

    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");

    private NumericFields() {
    }

    /**
     * Leading integer of the text ("23.7" reads 23, "7abc" reads 7), or null when the
     * text does not start with digits.
     */
    public static Integer parseInt(String value) {
        if (value == null) return null;
        Matcher m = LEADING_INT.matcher(value);
        if (!m.find()) return null;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
