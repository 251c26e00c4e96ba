package com.tennis.core.analytics;

import java.util.OptionalDouble;

/**
 * Serve and return rates for one side of a match. Empty means undetermined: a needed
 * column was absent or its denominator was zero.
 */
public record SideInsights(
        OptionalDouble firstServePercentage,
        OptionalDouble acesPerServiceGame,
        OptionalDouble breakPointConversion
) {
}
