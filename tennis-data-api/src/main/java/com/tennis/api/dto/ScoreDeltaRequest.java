package com.tennis.api.dto;

import com.tennis.core.model.Score;

public record ScoreDeltaRequest(
        Score previous,
        Score current
) {
}
