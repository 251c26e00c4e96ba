package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TournamentCategory {
    ATP("ATP"),
    WTA("WTA"),
    CHALLENGER("Challenger"),
    ITF("ITF"),
    EXHIBITION("Exhibition"),
    UNKNOWN("Unknown");

    private final String label;

    TournamentCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static TournamentCategory fromLabel(String label) {
        return Arrays.stream(values())
                .filter(c -> c.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tournament category: " + label));
    }

    @Override
    public String toString() {
        return label;
    }
}
