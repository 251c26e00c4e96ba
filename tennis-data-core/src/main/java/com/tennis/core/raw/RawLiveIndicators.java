package com.tennis.core.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawLiveIndicators(String serving, Boolean setPoint, Boolean matchPoint, Boolean breakPoint) {
}
