package com.tennis.api.service;

import com.tennis.api.config.TennisDataProperties;
import com.tennis.api.dto.CompetitionResponse;
import com.tennis.api.dto.HeadToHeadResponse;
import com.tennis.api.dto.MeetingSummary;
import com.tennis.api.dto.RankingEntry;
import com.tennis.api.dto.RankingsResponse;
import com.tennis.api.exception.ResourceNotFoundException;
import com.tennis.core.cache.CacheStats;
import com.tennis.core.cleaner.CleaningOptions;
import com.tennis.core.cleaner.MatchCleaner;
import com.tennis.core.format.DisplayView;
import com.tennis.core.format.MatchFormatter;
import com.tennis.core.loader.HistoricalDataLoader;
import com.tennis.core.loader.HistoricalMatchMapper;
import com.tennis.core.loader.HistoricalMatchRecord;
import com.tennis.core.loader.PlayerRecord;
import com.tennis.core.loader.RankingDates;
import com.tennis.core.loader.RankingRecord;
import com.tennis.core.model.Match;
import com.tennis.core.normalize.TournamentLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-side queries over the tabular archive: rankings, daily results, tournaments and
 * head-to-head records.
 */
@Service
public class HistoricalDataService {

    private static final Logger log = LoggerFactory.getLogger(HistoricalDataService.class);

    private final HistoricalDataLoader loader;
    private final MatchCleaner cleaner;
    private final MatchFormatter formatter;
    private final TennisDataProperties properties;
    private final Clock clock;

    public HistoricalDataService(
            HistoricalDataLoader loader,
            MatchCleaner cleaner,
            MatchFormatter formatter,
            TennisDataProperties properties,
            Clock clock
    ) {
        this.loader = loader;
        this.cleaner = cleaner;
        this.formatter = formatter;
        this.properties = properties;
        this.clock = clock;
    }

    // ============ RANKINGS ============

    /**
     * Ranking table for a snapshot date, or the latest snapshot when {@code date} is null.
     *
     * @param date  {@code YYYY-MM-DD} or {@code YYYYMMDD}
     * @param limit maximum number of rows, null or non-positive for all
     */
    public RankingsResponse getRankings(Integer limit, String date) {
        List<RankingRecord> snapshot;
        if (date == null || date.isBlank()) {
            snapshot = RankingDates.currentRankings(loader.loadCurrentRankings());
        } else {
            String compact = RankingDates.parseDate(date.trim());
            Integer year = RankingDates.yearOf(compact);
            if (year == null || compact.length() != 8) {
                throw new IllegalArgumentException("Invalid ranking date: " + date);
            }
            snapshot = RankingDates.rankingsByDate(loader.loadRankingsForYear(year), compact);
        }

        Map<String, PlayerRecord> registry = loader.playerRegistry();
        List<RankingEntry> entries = snapshot.stream()
                .limit(limit != null && limit > 0 ? limit : Long.MAX_VALUE)
                .map(r -> RankingEntry.from(r, registry.get(r.playerId())))
                .toList();

        String rankingDate = snapshot.isEmpty() ? null : snapshot.get(0).rankingDate();
        return new RankingsResponse(
                loader.getTour(),
                RankingDates.formatDate(rankingDate),
                RankingDates.yearOf(rankingDate),
                snapshot.size(),
                entries
        );
    }

    /**
     * Every snapshot date across all ranking files, most recent first.
     */
    public List<String> getRankingDates() {
        List<RankingRecord> all = new ArrayList<>(loader.loadRankingsForYears(loader.availableRankingYears()));
        all.addAll(loader.loadCurrentRankings());
        return RankingDates.availableRankingDates(all).stream()
                .map(RankingDates::formatDate)
                .toList();
    }

    public List<Integer> getRankingYears() {
        return loader.availableRankingYears();
    }

    // ============ MATCHES ============

    /**
     * Archived matches of tournaments starting on {@code date}, cleaned into canonical form.
     */
    public List<Match> getMatchesByDate(String date) {
        String compact = RankingDates.parseDate(date.trim());
        Integer year = RankingDates.yearOf(compact);
        if (year == null || compact.length() != 8) {
            throw new IllegalArgumentException("Invalid date: " + date);
        }

        HistoricalMatchMapper mapper = new HistoricalMatchMapper(loader.playerRegistry());
        CleaningOptions options = CleaningOptions.defaults().withDefaultLocation(properties.getDefaultLocation());
        List<Match> matches = loader.loadMatches(year).stream()
                .filter(m -> compact.equals(m.tourneyDate()))
                .map(mapper::toRawMatch)
                .map(raw -> cleaner.clean(raw, options))
                .toList();
        log.debug("Found {} archived matches on {}", matches.size(), date);
        return matches;
    }

    public List<DisplayView> getFormattedMatchesByDate(String date, boolean compact) {
        return formatter.formatList(getMatchesByDate(date), compact);
    }

    // ============ COMPETITIONS ============

    /**
     * Tournaments of the current and previous season, most prestigious first, then most recent.
     */
    public List<CompetitionResponse> getCompetitions() {
        int currentYear = LocalDate.now(clock).getYear();
        Map<String, HistoricalMatchRecord> firstMatchByTourney = new LinkedHashMap<>();
        for (HistoricalMatchRecord match : loader.loadMatches(List.of(currentYear, currentYear - 1))) {
            if (match.tourneyId() == null) continue;
            firstMatchByTourney.putIfAbsent(match.tourneyId(), match);
        }

        return firstMatchByTourney.values().stream()
                .sorted(Comparator.<HistoricalMatchRecord>comparingInt(m -> TournamentLevels.levelOrder(m.tourneyLevel()))
                        .thenComparing(HistoricalMatchRecord::tourneyDate,
                                Comparator.nullsLast(Comparator.<String>reverseOrder())))
                .map(CompetitionResponse::from)
                .toList();
    }

    // ============ HEAD TO HEAD ============

    public HeadToHeadResponse getHeadToHead(String player1Id, String player2Id) {
        PlayerRecord player1 = loader.findPlayer(player1Id)
                .orElseThrow(() -> new ResourceNotFoundException("Player", player1Id));
        PlayerRecord player2 = loader.findPlayer(player2Id)
                .orElseThrow(() -> new ResourceNotFoundException("Player", player2Id));

        List<MeetingSummary> meetings = loader.loadMatches(recentSeasons()).stream()
                .filter(m -> m.isBetween(player1Id, player2Id))
                .sorted(Comparator.comparing(HistoricalMatchRecord::tourneyDate,
                        Comparator.nullsLast(Comparator.<String>reverseOrder())))
                .map(MeetingSummary::from)
                .toList();

        return HeadToHeadResponse.create(
                player1.playerId(), player1.fullName(),
                player2.playerId(), player2.fullName(),
                meetings
        );
    }

    public List<Integer> recentSeasons() {
        return recentSeasons(properties.getHistoryYears());
    }

    /**
     * {@code count} seasons ending with the current one, most recent first.
     */
    public List<Integer> recentSeasons(int count) {
        int currentYear = LocalDate.now(clock).getYear();
        int seasons = Math.max(1, count);
        List<Integer> years = new ArrayList<>(seasons);
        for (int i = 0; i < seasons; i++) {
            years.add(currentYear - i);
        }
        return years;
    }

    // ============ CACHE ============

    public Map<String, CacheStats> cacheStats() {
        return loader.cacheStats();
    }

    public void clearCache() {
        loader.clearCache();
    }

    public boolean isDataAvailable() {
        return Files.isDirectory(loader.getDataDir());
    }

    public String getDataDirectory() {
        return loader.getDataDir().toString();
    }
}
