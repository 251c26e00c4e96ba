package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Start time as {@code HH:mm} UTC, duration as {@code "1h 35m"}, and a phrase relative
 * to now.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeView(String start, String duration, String relative) {
}
