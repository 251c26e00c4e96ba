package com.tennis.core.format;

import java.util.List;

/**
 * Display views bucketed by lifecycle: live, upcoming (scheduled), completed
 * (completed, retired, walkover) and everything else.
 */
public record MatchGroups(
        List<DisplayView> live,
        List<DisplayView> upcoming,
        List<DisplayView> completed,
        List<DisplayView> other
) {
}
