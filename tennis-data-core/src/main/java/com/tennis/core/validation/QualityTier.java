package com.tennis.core.validation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse data-quality grade derived from a validation outcome.
 */
public enum QualityTier {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String value;

    QualityTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Any error is poor; otherwise graded by warning count.
     */
    public static QualityTier of(int errorCount, int warningCount) {
        if (errorCount > 0) return POOR;
        if (warningCount == 0) return EXCELLENT;
        if (warningCount <= 2) return GOOD;
        return FAIR;
    }
}
