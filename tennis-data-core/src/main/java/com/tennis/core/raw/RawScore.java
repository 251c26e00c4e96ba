package com.tennis.core.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawScore(List<RawSet> sets, RawGames games, RawGames currentSet) {

    public static RawScore ofSets(List<RawSet> sets) {
        return new RawScore(sets, null, null);
    }
}
