package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-level flags from the live feed. {@code serving} is 1 or 2 when known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LiveIndicators(Integer serving, boolean setPoint, boolean matchPoint, boolean breakPoint) {

    public static LiveIndicators none() {
        return new LiveIndicators(null, false, false, false);
    }
}
