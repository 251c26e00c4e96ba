package com.tennis.api.dto;

import com.tennis.core.loader.HistoricalMatchRecord;
import com.tennis.core.loader.RankingDates;
import com.tennis.core.normalize.TournamentLevels;

/**
 * Single past meeting in a head-to-head record.
 */
public record MeetingSummary(
        String matchKey,
        String date,
        String tournament,
        String level,
        String surface,
        String round,
        String winnerId,
        String winnerName,
        String score
) {
    public static MeetingSummary from(HistoricalMatchRecord match) {
        return new MeetingSummary(
                match.key(),
                RankingDates.formatDate(match.tourneyDate()),
                match.tourneyName(),
                TournamentLevels.levelName(match.tourneyLevel()),
                match.surface(),
                match.round(),
                match.winner().id(),
                match.winner().name(),
                match.score()
        );
    }
}
