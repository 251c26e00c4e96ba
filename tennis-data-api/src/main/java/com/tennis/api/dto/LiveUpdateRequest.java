package com.tennis.api.dto;

import com.tennis.core.model.LiveUpdate;
import com.tennis.core.model.Match;

public record LiveUpdateRequest(
        Match previous,
        LiveUpdate update
) {
}
