package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Surface {
    HARD("Hard"),
    CLAY("Clay"),
    GRASS("Grass"),
    INDOOR("Indoor"),
    CARPET("Carpet");

    private final String label;

    Surface(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Surface fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown surface: " + label));
    }

    @Override
    public String toString() {
        return label;
    }
}
