package com.tennis.api.service;

import com.tennis.api.config.TennisDataProperties;
import com.tennis.api.dto.PerformanceReport;
import com.tennis.api.dto.PlayerProfileResponse;
import com.tennis.api.exception.ResourceNotFoundException;
import com.tennis.core.analytics.PerformanceAnalyzer;
import com.tennis.core.analytics.TierRecord;
import com.tennis.core.cleaner.MatchCleaner;
import com.tennis.core.format.MatchFormatter;
import com.tennis.core.loader.HistoricalDataLoader;
import com.tennis.core.model.Handedness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.tennis.api.service.ArchiveTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayerProfileServiceTest {

    @TempDir
    Path dataDir;

    private PlayerProfileService service;

    @BeforeEach
    void setUp() throws IOException {
        ArchiveTestData.write(dataDir);
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        HistoricalDataLoader loader = new HistoricalDataLoader(dataDir, "atp", Duration.ofMinutes(30), clock);
        HistoricalDataService historical = new HistoricalDataService(loader, new MatchCleaner(clock),
                new MatchFormatter(clock), new TennisDataProperties(), clock);
        service = new PlayerProfileService(loader, historical, new PerformanceAnalyzer(), clock);
    }

    @Test
    void getProfile_combinesRegistryRankingsAndRecord() {
        PlayerProfileResponse profile = service.getProfile(SINNER);

        assertThat(profile.name()).isEqualTo("Jannik Sinner");
        assertThat(profile.countryCode()).isEqualTo("IT");
        assertThat(profile.handedness()).isEqualTo(Handedness.RIGHT);
        assertThat(profile.dateOfBirth()).isEqualTo("2001-08-16");
        assertThat(profile.age()).isEqualTo(22);
        assertThat(profile.height()).isEqualTo(191);
        assertThat(profile.currentRanking()).isEqualTo(1);
        assertThat(profile.currentPoints()).isEqualTo(9525);
        assertThat(profile.highestRanking()).isEqualTo(1);
        assertThat(profile.highestRankingDate()).isEqualTo("2024-05-27");

        assertThat(profile.careerRecord().wins()).isEqualTo(3);
        assertThat(profile.careerRecord().losses()).isEqualTo(2);
        assertThat(profile.surfacePerformance()).containsOnlyKeys("Hard");
        assertThat(profile.tierPerformance()).extracting(TierRecord::level)
                .containsExactly("Grand Slam", "Masters 1000", "Tour Finals");
        assertThat(profile.totalTitles()).isEqualTo(1);
    }

    @Test
    void getProfile_highestRankingFromEarlierSnapshot() {
        PlayerProfileResponse profile = service.getProfile(DJOKOVIC);

        assertThat(profile.currentRanking()).isEqualTo(2);
        assertThat(profile.highestRanking()).isEqualTo(1);
        assertThat(profile.highestRankingDate()).isEqualTo("2024-01-01");
    }

    @Test
    void getProfile_unknownPlayer_throwsNotFound() {
        assertThatThrownBy(() -> service.getProfile("1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getPerformance_limitsToRequestedSeasons() {
        PerformanceReport report = service.getPerformance(SINNER, 1);

        assertThat(report.seasons()).containsExactly(2024);
        assertThat(report.record().wins()).isEqualTo(2);
        assertThat(report.record().losses()).isEqualTo(1);
        assertThat(report.recentMatches()).hasSize(3);
        assertThat(report.recentMatches().get(0).matchKey()).isEqualTo("2024-0404_294");
        assertThat(report.serve().matchesWithStats()).isEqualTo(1);
        assertThat(report.serve().firstServePercentage()).isPresent();
    }

    @Test
    void getPerformance_nonPositiveYears_throws() {
        assertThatThrownBy(() -> service.getPerformance(SINNER, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void age_unparseableDate_isNull() {
        assertThat(service.age("1987")).isNull();
        assertThat(service.age(null)).isNull();
        assertThat(service.age("19870522")).isEqualTo(37);
    }
}
