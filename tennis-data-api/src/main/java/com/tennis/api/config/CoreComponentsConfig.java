package com.tennis.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tennis.core.analytics.PerformanceAnalyzer;
import com.tennis.core.cleaner.DataQualityAnalyzer;
import com.tennis.core.cleaner.MatchCleaner;
import com.tennis.core.format.MatchFormatter;
import com.tennis.core.loader.HistoricalDataLoader;
import com.tennis.core.validation.MatchValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Exposes the core pipeline components as singletons sharing one clock.
 */
@Configuration
public class CoreComponentsConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreComponentsConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MatchCleaner matchCleaner(Clock clock) {
        return new MatchCleaner(clock);
    }

    @Bean
    public MatchValidator matchValidator(TennisDataProperties properties, Clock clock, ObjectMapper objectMapper) {
        return new MatchValidator(properties.getValidationCacheTtl(), clock, objectMapper);
    }

    @Bean
    public MatchFormatter matchFormatter(Clock clock) {
        return new MatchFormatter(clock);
    }

    @Bean
    public DataQualityAnalyzer dataQualityAnalyzer() {
        return new DataQualityAnalyzer();
    }

    @Bean
    public PerformanceAnalyzer performanceAnalyzer() {
        return new PerformanceAnalyzer();
    }

    @Bean
    public HistoricalDataLoader historicalDataLoader(TennisDataProperties properties, Clock clock) {
        Path dataDir = Path.of(properties.getDataPath()).toAbsolutePath();
        log.info("Historical archive: {} (tour {})", dataDir, properties.getTour());
        return new HistoricalDataLoader(dataDir, properties.getTour(), properties.getLoaderCacheTtl(), clock);
    }
}
