package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TournamentView(String name, String category, String surface, String location, String level) {
}
