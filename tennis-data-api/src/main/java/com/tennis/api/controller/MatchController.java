package com.tennis.api.controller;

import com.tennis.api.dto.LiveUpdateRequest;
import com.tennis.api.dto.ProcessedMatchResponse;
import com.tennis.api.dto.ScoreDeltaRequest;
import com.tennis.api.service.LiveMatchService;
import com.tennis.core.cache.CacheStats;
import com.tennis.core.cleaner.CleaningOptions;
import com.tennis.core.cleaner.DataQualityReport;
import com.tennis.core.format.DisplayView;
import com.tennis.core.format.ScoreDelta;
import com.tennis.core.model.Match;
import com.tennis.core.raw.RawMatch;
import com.tennis.core.validation.ValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Live match pipeline: clean raw feed payloads, validate canonical matches and build
 * display views.
 */
@RestController
@RequestMapping("/api/matches")
@Tag(name = "Matches", description = "Clean, validate and format live match data")
public class MatchController {

    private final LiveMatchService liveMatchService;

    public MatchController(LiveMatchService liveMatchService) {
        this.liveMatchService = liveMatchService;
    }

    // =============== PIPELINE ===============

    @PostMapping("/clean")
    @Operation(summary = "Clean a raw match", description = "Normalize a raw feed payload into a canonical match")
    public Match clean(
            @RequestBody RawMatch raw,
            @Parameter(description = "Fill optional fields such as the round with defaults")
            @RequestParam(defaultValue = "true") boolean fillMissingData,
            @Parameter(description = "Parse set scores strictly")
            @RequestParam(defaultValue = "true") boolean validateScores,
            @Parameter(description = "Reorder \"Last, First\" player names")
            @RequestParam(defaultValue = "true") boolean normalizeNames,
            @Parameter(description = "Location used when the source location is missing", example = "Unknown Location")
            @RequestParam(required = false) String defaultLocation
    ) {
        CleaningOptions options = liveMatchService.options(fillMissingData, validateScores, normalizeNames, defaultLocation);
        return liveMatchService.clean(raw, options);
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate a match", description = "Check a canonical match against tennis rules")
    public ValidationResult validate(@RequestBody Match match) {
        return liveMatchService.validate(match);
    }

    @PostMapping("/format")
    @Operation(summary = "Format a match", description = "Build the display view of a canonical match")
    public DisplayView format(
            @RequestBody Match match,
            @Parameter(description = "Show surnames only")
            @RequestParam(defaultValue = "false") boolean compact
    ) {
        return liveMatchService.format(match, compact);
    }

    @PostMapping("/process")
    @Operation(summary = "Process a raw match", description = "Clean, validate and format in one call")
    public ProcessedMatchResponse process(
            @RequestBody RawMatch raw,
            @Parameter(description = "Show surnames only")
            @RequestParam(defaultValue = "false") boolean compact
    ) {
        return liveMatchService.process(raw, liveMatchService.defaultOptions(), compact);
    }

    @PostMapping("/format-list")
    @Operation(summary = "Format several matches",
            description = "Display views in input order, or grouped into live, upcoming, completed and other")
    public ResponseEntity<?> formatList(
            @RequestBody List<Match> matches,
            @Parameter(description = "Show surnames only")
            @RequestParam(defaultValue = "false") boolean compact,
            @Parameter(description = "Group the views by match status")
            @RequestParam(defaultValue = "false") boolean groupByStatus
    ) {
        if (groupByStatus) {
            return ResponseEntity.ok(liveMatchService.groupByStatus(matches, compact));
        }
        return ResponseEntity.ok(liveMatchService.formatList(matches, compact));
    }

    // =============== LIVE UPDATES ===============

    @PostMapping("/live-update/validate")
    @Operation(summary = "Validate a live update", description = "Check an incremental update against the previous match state")
    public ValidationResult validateLiveUpdate(@RequestBody LiveUpdateRequest request) {
        return liveMatchService.validateLiveUpdate(request.previous(), request.update());
    }

    @PostMapping("/score-delta")
    @Operation(summary = "Compare two scores", description = "Games gained per set between two snapshots (204 when either is missing)")
    public ResponseEntity<ScoreDelta> scoreDelta(@RequestBody ScoreDeltaRequest request) {
        return liveMatchService.scoreDelta(request.previous(), request.current())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // =============== QUALITY ===============

    @PostMapping("/quality")
    @Operation(summary = "Data quality report", description = "Count location, score, name and country issues in a raw batch")
    public DataQualityReport quality(@RequestBody List<RawMatch> matches) {
        return liveMatchService.qualityReport(matches);
    }

    // =============== CACHE ===============

    @GetMapping("/validation-cache")
    @Operation(summary = "Validation cache stats")
    public CacheStats validationCacheStats() {
        return liveMatchService.validationCacheStats();
    }

    @DeleteMapping("/validation-cache")
    @Operation(summary = "Clear validation cache")
    public ResponseEntity<Void> clearValidationCache() {
        liveMatchService.clearValidationCache();
        return ResponseEntity.noContent().build();
    }
}
