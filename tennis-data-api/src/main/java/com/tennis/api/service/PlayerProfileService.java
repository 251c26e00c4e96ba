package com.tennis.api.service;

import com.tennis.api.dto.PerformanceReport;
import com.tennis.api.dto.PlayerProfileResponse;
import com.tennis.api.exception.ResourceNotFoundException;
import com.tennis.core.analytics.MatchInsights;
import com.tennis.core.analytics.PerformanceAnalyzer;
import com.tennis.core.analytics.TierRecord;
import com.tennis.core.loader.HistoricalDataLoader;
import com.tennis.core.loader.HistoricalMatchRecord;
import com.tennis.core.loader.PlayerRecord;
import com.tennis.core.loader.RankingDates;
import com.tennis.core.loader.RankingRecord;
import com.tennis.core.normalize.CountryCodes;
import com.tennis.core.normalize.NumericFields;
import com.tennis.core.normalize.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds player profiles and performance reports from the archive.
 */
@Service
public class PlayerProfileService {

    private static final Logger log = LoggerFactory.getLogger(PlayerProfileService.class);

    private static final int RECENT_MATCH_INSIGHTS = 10;

    private final HistoricalDataLoader loader;
    private final HistoricalDataService historicalDataService;
    private final PerformanceAnalyzer analyzer;
    private final Clock clock;

    public PlayerProfileService(
            HistoricalDataLoader loader,
            HistoricalDataService historicalDataService,
            PerformanceAnalyzer analyzer,
            Clock clock
    ) {
        this.loader = loader;
        this.historicalDataService = historicalDataService;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    /**
     * @throws ResourceNotFoundException when the registry has no such player
     */
    public PlayerProfileResponse getProfile(String playerId) {
        PlayerRecord player = requirePlayer(playerId);
        List<HistoricalMatchRecord> matches = playerMatches(playerId, historicalDataService.recentSeasons());

        List<RankingRecord> rankings = loader.loadCurrentRankings();
        Optional<RankingRecord> current = RankingDates.currentRankings(rankings).stream()
                .filter(r -> playerId.equals(r.playerId()))
                .findFirst();
        Optional<RankingRecord> highest = rankings.stream()
                .filter(r -> playerId.equals(r.playerId()))
                .min(Comparator.comparingInt(RankingRecord::rank)
                        .thenComparing(RankingRecord::rankingDate, Comparator.nullsLast(Comparator.<String>naturalOrder())));

        List<TierRecord> tiers = analyzer.tierPerformance(playerId, matches);
        int titles = tiers.stream().mapToInt(TierRecord::titles).sum();

        return new PlayerProfileResponse(
                player.playerId(),
                player.fullName(),
                player.abbreviation(),
                player.ioc(),
                CountryCodes.fromIoc(player.ioc()),
                Vocabulary.handedness(player.hand()),
                RankingDates.formatDate(player.dateOfBirth()),
                age(player.dateOfBirth()),
                NumericFields.parseInt(player.height()),
                current.map(RankingRecord::rank).orElse(null),
                current.map(RankingRecord::points).orElse(null),
                highest.map(RankingRecord::rank).orElse(null),
                highest.map(r -> RankingDates.formatDate(r.rankingDate())).orElse(null),
                analyzer.careerRecord(playerId, matches),
                analyzer.surfacePerformance(playerId, matches),
                tiers,
                titles
        );
    }

    /**
     * Analytics over the last {@code years} seasons.
     */
    public PerformanceReport getPerformance(String playerId, int years) {
        if (years < 1) {
            throw new IllegalArgumentException("years must be at least 1");
        }
        PlayerRecord player = requirePlayer(playerId);
        List<Integer> seasons = historicalDataService.recentSeasons(years);
        List<HistoricalMatchRecord> matches = playerMatches(playerId, seasons);

        List<MatchInsights> recent = matches.stream()
                .sorted(Comparator.comparing(HistoricalMatchRecord::tourneyDate,
                        Comparator.nullsLast(Comparator.<String>reverseOrder())))
                .limit(RECENT_MATCH_INSIGHTS)
                .map(analyzer::matchInsights)
                .toList();

        log.debug("Performance report for {} over {} match(es)", playerId, matches.size());
        return new PerformanceReport(
                player.playerId(),
                player.fullName(),
                seasons,
                analyzer.careerRecord(playerId, matches),
                analyzer.surfacePerformance(playerId, matches),
                analyzer.tierPerformance(playerId, matches),
                analyzer.serveProfile(playerId, matches),
                recent
        );
    }

    // ============ HELPERS ============

    private PlayerRecord requirePlayer(String playerId) {
        return loader.findPlayer(playerId)
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));
    }

    private List<HistoricalMatchRecord> playerMatches(String playerId, List<Integer> seasons) {
        return loader.loadMatches(seasons).stream()
                .filter(m -> m.involves(playerId))
                .toList();
    }

    /**
     * Whole years since a {@code YYYYMMDD} birth date, or null when unknown.
     */
    Integer age(String dateOfBirth) {
        if (dateOfBirth == null || dateOfBirth.isBlank()) return null;
        try {
            LocalDate dob = LocalDate.parse(dateOfBirth.trim(), DateTimeFormatter.BASIC_ISO_DATE);
            return Period.between(dob, LocalDate.now(clock)).getYears();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date of birth: {}", dateOfBirth);
            return null;
        }
    }
}
