package com.tennis.core.cleaner;

import java.util.List;

/**
 * Issue counts over a batch of source matches. Each count is the number of matches with
 * at least one issue of that kind.
 */
public record DataQualityReport(
        int totalMatches,
        int locationIssues,
        int scoreIssues,
        int playerNameIssues,
        int countryIssues,
        List<String> recommendations
) {
    public DataQualityReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public int totalIssues() {
        return locationIssues + scoreIssues + playerNameIssues + countryIssues;
    }
}
