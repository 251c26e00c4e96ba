package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Handedness {
    RIGHT("right"),
    LEFT("left");

    private final String value;

    Handedness(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
