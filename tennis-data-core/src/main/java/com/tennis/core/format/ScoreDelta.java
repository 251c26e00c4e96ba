package com.tennis.core.format;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Difference between two successive scores of the same match.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreDelta(List<SetChange> setChanges, GameChange gameChange, boolean newSet) {

    public ScoreDelta {
        setChanges = setChanges == null ? List.of() : List.copyOf(setChanges);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return setChanges.isEmpty() && gameChange == null && !newSet;
    }
}
