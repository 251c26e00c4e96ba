package com.tennis.core.loader;

import com.tennis.core.model.TournamentCategory;
import com.tennis.core.normalize.CountryCodes;
import com.tennis.core.normalize.TournamentLevels;
import com.tennis.core.normalize.TournamentLocations;
import com.tennis.core.normalize.TournamentLocations.TournamentLocation;
import com.tennis.core.raw.RawMatch;
import com.tennis.core.raw.RawPlayer;
import com.tennis.core.raw.RawScore;
import com.tennis.core.raw.RawTournament;

import java.util.List;
import java.util.Map;

/**
 * Turns archive rows into raw matches for the cleaner. Players are taken from the
 * registry when known and otherwise built from the row's own winner/loser columns.
 */
public class HistoricalMatchMapper {

    private final Map<String, PlayerRecord> players;

    public HistoricalMatchMapper(Map<String, PlayerRecord> players) {
        this.players = players != null ? players : Map.of();
    }

    public RawMatch toRawMatch(HistoricalMatchRecord row) {
        ScoreStringParser.ParsedScore parsed = ScoreStringParser.parse(row.score());

        return new RawMatch(
                row.key(),
                toTournament(row),
                row.round(),
                parsed.outcome().getValue(),
                List.of(toPlayer(row.winner()), toPlayer(row.loser())),
                parsed.sets().isEmpty() ? null : RawScore.ofSets(parsed.sets()),
                row.tourneyDate(),
                null,
                null,
                row.minutes() != null ? row.minutes().toString() : null,
                null
        );
    }

    RawTournament toTournament(HistoricalMatchRecord row) {
        TournamentCategory category = TournamentLevels.categoryForLevel(row.tourneyLevel(), row.tourneyName());
        TournamentLocation location = TournamentLocations.fromTournamentName(row.tourneyName()).orElse(null);

        return new RawTournament(
                row.tourneyId(),
                row.tourneyName(),
                category.getLabel(),
                row.surface(),
                null,
                location != null ? location.city() : null,
                location != null ? location.country() : null,
                row.tourneyDate(),
                row.tourneyDate(),
                TournamentLevels.levelName(row.tourneyLevel())
        );
    }

    RawPlayer toPlayer(MatchSide side) {
        PlayerRecord known = side.id() != null ? players.get(side.id()) : null;

        String name = known != null && !known.fullName().isEmpty() ? known.fullName() : side.name();
        String ioc = known != null && known.ioc() != null && !known.ioc().isBlank() ? known.ioc() : side.ioc();
        String hand = known != null && known.hand() != null ? known.hand() : side.hand();
        String height = known != null && known.height() != null && !known.height().isBlank()
                ? known.height() : side.height();
        String code = ioc != null && !ioc.isBlank() ? CountryCodes.fromIoc(ioc) : null;

        return new RawPlayer(
                side.id(),
                name,
                ioc,
                null,
                code,
                null,
                known != null ? known.abbreviation() : null,
                side.rank() != null ? side.rank().toString() : null,
                side.age(),
                height,
                null,
                hand,
                side.seed()
        );
    }
}
