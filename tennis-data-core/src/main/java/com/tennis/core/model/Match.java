package com.tennis.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Canonical match as produced by the cleaner. Players keep source order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Match(
        String id,
        Tournament tournament,
        String round,
        MatchStatus status,
        List<Player> players,
        Score score,
        String startTime,
        String endTime,
        String court,
        Integer durationMinutes,
        LiveIndicators liveIndicators
) {
    public Match {
        players = players == null ? List.of() : List.copyOf(players);
    }

    public Player player1() {
        return players.isEmpty() ? null : players.get(0);
    }

    public Player player2() {
        return players.size() < 2 ? null : players.get(1);
    }
}
