package com.tennis.api.dto;

import com.tennis.core.format.DisplayView;
import com.tennis.core.model.Match;
import com.tennis.core.validation.ValidationResult;

/**
 * Output of the full live pipeline: cleaned match, its validation verdict and display view.
 */
public record ProcessedMatchResponse(
        Match match,
        ValidationResult validation,
        DisplayView display
) {
}
