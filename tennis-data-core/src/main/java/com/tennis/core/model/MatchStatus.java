package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Set;

/**
 * Lifecycle state of a match.
 */
public enum MatchStatus {
    SCHEDULED("scheduled"),
    LIVE("live"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    WALKOVER("walkover"),
    RETIRED("retired");

    private final String value;

    MatchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * States with no outgoing transitions.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == WALKOVER || this == RETIRED;
    }

    /**
     * Allowed successor states for a live update.
     */
    public Set<MatchStatus> allowedTransitions() {
        return switch (this) {
            case SCHEDULED -> Set.of(LIVE, CANCELLED);
            case LIVE -> Set.of(COMPLETED, RETIRED, CANCELLED);
            default -> Set.of();
        };
    }

    @JsonCreator
    public static MatchStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown match status: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
