package com.tennis.api.dto;

import com.tennis.core.loader.HistoricalMatchRecord;
import com.tennis.core.loader.RankingDates;
import com.tennis.core.normalize.TournamentLevels;

/**
 * Tournament summary derived from the first archived match seen for it.
 */
public record CompetitionResponse(
        String id,
        String name,
        String level,
        String levelName,
        String surface,
        String date
) {
    public static CompetitionResponse from(HistoricalMatchRecord match) {
        return new CompetitionResponse(
                match.tourneyId(),
                match.tourneyName(),
                match.tourneyLevel(),
                TournamentLevels.levelName(match.tourneyLevel()),
                match.surface(),
                RankingDates.formatDate(match.tourneyDate())
        );
    }
}
