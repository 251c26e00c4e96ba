package com.tennis.api.config;

import com.tennis.core.cleaner.CleaningOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "tennis.data")
public class TennisDataProperties {

    /**
     * Directory holding the tabular archive ({@code atp_players.csv}, {@code atp_matches_2024.csv}, ...).
     */
    private String dataPath = "data";
    private String tour = "atp";
    private Duration validationCacheTtl = Duration.ofMinutes(5);
    private Duration loaderCacheTtl = Duration.ofMinutes(30);
    private String defaultLocation = CleaningOptions.UNKNOWN_LOCATION;

    /**
     * Seasons looked back over for profiles and head-to-head records.
     */
    private int historyYears = 5;

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public String getTour() {
        return tour;
    }

    public void setTour(String tour) {
        this.tour = tour;
    }

    public Duration getValidationCacheTtl() {
        return validationCacheTtl;
    }

    public void setValidationCacheTtl(Duration validationCacheTtl) {
        this.validationCacheTtl = validationCacheTtl;
    }

    public Duration getLoaderCacheTtl() {
        return loaderCacheTtl;
    }

    public void setLoaderCacheTtl(Duration loaderCacheTtl) {
        this.loaderCacheTtl = loaderCacheTtl;
    }

    public String getDefaultLocation() {
        return defaultLocation;
    }

    public void setDefaultLocation(String defaultLocation) {
        this.defaultLocation = defaultLocation;
    }

    public int getHistoryYears() {
        return historyYears;
    }

    public void setHistoryYears(int historyYears) {
        this.historyYears = historyYears;
    }
}
