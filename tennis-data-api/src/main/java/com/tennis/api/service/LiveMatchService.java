package com.tennis.api.service;

import com.tennis.api.config.TennisDataProperties;
import com.tennis.api.dto.ProcessedMatchResponse;
import com.tennis.core.cache.CacheStats;
import com.tennis.core.cleaner.CleaningOptions;
import com.tennis.core.cleaner.DataQualityAnalyzer;
import com.tennis.core.cleaner.DataQualityReport;
import com.tennis.core.cleaner.MatchCleaner;
import com.tennis.core.format.DisplayView;
import com.tennis.core.format.MatchFormatter;
import com.tennis.core.format.MatchGroups;
import com.tennis.core.format.ScoreDelta;
import com.tennis.core.model.LiveUpdate;
import com.tennis.core.model.Match;
import com.tennis.core.model.Score;
import com.tennis.core.raw.RawMatch;
import com.tennis.core.validation.MatchValidator;
import com.tennis.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs feed payloads through clean, validate and format.
 */
@Service
public class LiveMatchService {

    private static final Logger log = LoggerFactory.getLogger(LiveMatchService.class);

    private final MatchCleaner cleaner;
    private final MatchValidator validator;
    private final MatchFormatter formatter;
    private final DataQualityAnalyzer qualityAnalyzer;
    private final TennisDataProperties properties;

    public LiveMatchService(
            MatchCleaner cleaner,
            MatchValidator validator,
            MatchFormatter formatter,
            DataQualityAnalyzer qualityAnalyzer,
            TennisDataProperties properties
    ) {
        this.cleaner = cleaner;
        this.validator = validator;
        this.formatter = formatter;
        this.qualityAnalyzer = qualityAnalyzer;
        this.properties = properties;
    }

    /**
     * Cleaning options with the configured default location filling in for a missing one.
     */
    public CleaningOptions options(boolean fillMissingData, boolean validateScores, boolean normalizeNames,
                                   String defaultLocation) {
        String location = defaultLocation == null || defaultLocation.isBlank()
                ? properties.getDefaultLocation()
                : defaultLocation;
        return new CleaningOptions(fillMissingData, validateScores, normalizeNames, location);
    }

    public CleaningOptions defaultOptions() {
        return options(true, true, true, null);
    }

    // ============ PIPELINE ============

    public Match clean(RawMatch raw, CleaningOptions options) {
        return cleaner.clean(raw, options);
    }

    public ValidationResult validate(Match match) {
        return validator.validate(match);
    }

    public DisplayView format(Match match, boolean compact) {
        return compact ? formatter.formatCompact(match) : formatter.format(match);
    }

    public ProcessedMatchResponse process(RawMatch raw, CleaningOptions options, boolean compact) {
        Match match = cleaner.clean(raw, options);
        ValidationResult validation = validator.validate(match);
        if (!validation.valid()) {
            log.warn("Match {} failed validation: {}", match.id(), validation.errors());
        } else if (!validation.warnings().isEmpty()) {
            log.debug("Match {} has {} warning(s)", match.id(), validation.warnings().size());
        }
        return new ProcessedMatchResponse(match, validation, format(match, compact));
    }

    public List<DisplayView> formatList(List<Match> matches, boolean compact) {
        return formatter.formatList(matches, compact);
    }

    public MatchGroups groupByStatus(List<Match> matches, boolean compact) {
        return formatter.groupByStatus(matches, compact);
    }

    // ============ LIVE UPDATES ============

    public ValidationResult validateLiveUpdate(Match previous, LiveUpdate update) {
        ValidationResult result = validator.validateLiveUpdate(previous, update);
        if (!result.valid()) {
            log.warn("Rejected live update for {}: {}", previous != null ? previous.id() : null, result.errors());
        }
        return result;
    }

    public Optional<ScoreDelta> scoreDelta(Score previous, Score current) {
        return formatter.compareScores(previous, current);
    }

    // ============ QUALITY & CACHE ============

    public DataQualityReport qualityReport(List<RawMatch> matches) {
        DataQualityReport report = qualityAnalyzer.analyze(matches);
        log.info("Quality report over {} matches: {} issue(s)", report.totalMatches(), report.totalIssues());
        return report;
    }

    public CacheStats validationCacheStats() {
        return validator.cacheStats();
    }

    public void clearValidationCache() {
        validator.clearCache();
        log.info("Validation cache cleared");
    }
}
