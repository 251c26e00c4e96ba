package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Presentation-ready facts about one match.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DisplayView(
        String id,
        StatusView status,
        TournamentView tournament,
        String round,
        List<PlayerView> players,
        ScoreView score,
        TimeView time,
        IndicatorsView indicators,
        String court
) {
    public DisplayView {
        players = players == null ? List.of() : List.copyOf(players);
    }

    public DisplayView withPlayers(List<PlayerView> newPlayers) {
        return new DisplayView(id, status, tournament, round, newPlayers, score, time, indicators, court);
    }
}
