package com.tennis.core.validation;

import java.util.List;

/**
 * Outcome of validating a match or a live update. Valid exactly when there are no errors.
 */
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        QualityTier dataQuality
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings,
                QualityTier.of(errors.size(), warnings.size()));
    }
}
