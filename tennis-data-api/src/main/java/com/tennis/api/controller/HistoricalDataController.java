package com.tennis.api.controller;

import com.tennis.api.dto.CompetitionResponse;
import com.tennis.api.dto.HeadToHeadResponse;
import com.tennis.api.dto.PerformanceReport;
import com.tennis.api.dto.PlayerProfileResponse;
import com.tennis.api.dto.RankingsResponse;
import com.tennis.api.service.HistoricalDataService;
import com.tennis.api.service.PlayerProfileService;
import com.tennis.core.cache.CacheStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Queries over the historical archive.
 */
@RestController
@RequestMapping("/api/data")
@Tag(name = "Historical Data", description = "Rankings, results, profiles and head-to-head records from the archive")
public class HistoricalDataController {

    private final HistoricalDataService historicalDataService;
    private final PlayerProfileService playerProfileService;

    public HistoricalDataController(
            HistoricalDataService historicalDataService,
            PlayerProfileService playerProfileService
    ) {
        this.historicalDataService = historicalDataService;
        this.playerProfileService = playerProfileService;
    }

    // =============== RANKINGS ===============

    @GetMapping("/rankings")
    @Operation(summary = "Rankings", description = "Ranking table of the latest snapshot or a given date (cached for 1 hour)")
    public ResponseEntity<RankingsResponse> getRankings(
            @Parameter(description = "Maximum number of rows", example = "100")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Snapshot date (YYYY-MM-DD)", example = "2024-01-01")
            @RequestParam(required = false) String date
    ) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(historicalDataService.getRankings(limit, date));
    }

    @GetMapping("/rankings/dates")
    @Operation(summary = "Ranking dates", description = "All snapshot dates, most recent first")
    public ResponseEntity<List<String>> getRankingDates() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(historicalDataService.getRankingDates());
    }

    @GetMapping("/rankings/years")
    @Operation(summary = "Ranking years", description = "Years with ranking data, most recent first")
    public ResponseEntity<List<Integer>> getRankingYears() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(historicalDataService.getRankingYears());
    }

    // =============== MATCHES ===============

    @GetMapping("/matches/{date}")
    @Operation(summary = "Matches by date", description = "Archived matches of tournaments starting on the given date")
    public ResponseEntity<?> getMatchesByDate(
            @Parameter(description = "Tournament start date (YYYY-MM-DD)", example = "2024-01-01")
            @PathVariable String date,
            @Parameter(description = "Return display views instead of canonical matches")
            @RequestParam(defaultValue = "false") boolean formatted,
            @Parameter(description = "Show surnames only (with formatted=true)")
            @RequestParam(defaultValue = "false") boolean compact
    ) {
        Object body = formatted
                ? historicalDataService.getFormattedMatchesByDate(date, compact)
                : historicalDataService.getMatchesByDate(date);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(body);
    }

    @GetMapping("/competitions")
    @Operation(summary = "Competitions", description = "Tournaments of the current and previous season, most prestigious first")
    public ResponseEntity<List<CompetitionResponse>> getCompetitions() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(historicalDataService.getCompetitions());
    }

    // =============== PLAYERS ===============

    @GetMapping("/players/{playerId}")
    @Operation(summary = "Player profile", description = "Registry details, ranking highlights and recent-seasons record")
    public ResponseEntity<PlayerProfileResponse> getPlayer(
            @Parameter(description = "Archive player id", example = "104925")
            @PathVariable String playerId
    ) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(playerProfileService.getProfile(playerId));
    }

    @GetMapping("/players/{playerId}/performance")
    @Operation(summary = "Player performance", description = "Surface, tier and serve analytics over recent seasons")
    public ResponseEntity<PerformanceReport> getPerformance(
            @Parameter(description = "Archive player id", example = "104925")
            @PathVariable String playerId,
            @Parameter(description = "Number of seasons", example = "5")
            @RequestParam(defaultValue = "5") int years
    ) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(playerProfileService.getPerformance(playerId, years));
    }

    @GetMapping("/head-to-head")
    @Operation(summary = "Head-to-head", description = "Meetings between two players over recent seasons")
    public ResponseEntity<HeadToHeadResponse> getHeadToHead(
            @Parameter(description = "First player id", example = "104925")
            @RequestParam String player1,
            @Parameter(description = "Second player id", example = "206173")
            @RequestParam String player2
    ) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(historicalDataService.getHeadToHead(player1, player2));
    }

    // =============== CACHE ===============

    @GetMapping("/cache")
    @Operation(summary = "Loader cache stats")
    public Map<String, CacheStats> getCacheStats() {
        return historicalDataService.cacheStats();
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear loader caches", description = "Forces the archive files to be re-read")
    public ResponseEntity<Void> clearCache() {
        historicalDataService.clearCache();
        return ResponseEntity.noContent().build();
    }
}
