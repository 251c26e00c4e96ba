package com.tennis.core.normalize;

import com.tennis.core.model.TournamentCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TournamentLevelsTest {

    @Test
    void levelName_knownAndUnknownCodes() {
        assertThat(TournamentLevels.levelName("G")).isEqualTo("Grand Slam");
        assertThat(TournamentLevels.levelName("M")).isEqualTo("Masters 1000");
        assertThat(TournamentLevels.levelName("Q")).isEqualTo("Q");
        assertThat(TournamentLevels.levelName(null)).isEqualTo("Unknown");
    }

    @Test
    void levelOrder_ranksSlamsFirst() {
        assertThat(TournamentLevels.levelOrder("G")).isLessThan(TournamentLevels.levelOrder("M"));
        assertThat(TournamentLevels.levelOrder("A")).isLessThan(TournamentLevels.levelOrder("C"));
        assertThat(TournamentLevels.levelOrder("X")).isEqualTo(7);
    }

    @Test
    void categoryForLevel_usesCodeAndName() {
        assertThat(TournamentLevels.categoryForLevel("C", "Bergamo")).isEqualTo(TournamentCategory.CHALLENGER);
        assertThat(TournamentLevels.categoryForLevel("A", "Bergamo Challenger")).isEqualTo(TournamentCategory.CHALLENGER);
        assertThat(TournamentLevels.categoryForLevel("G", "Wimbledon")).isEqualTo(TournamentCategory.ATP);
    }

    @Test
    void inferLevel_fromName() {
        assertThat(TournamentLevels.inferLevel(TournamentCategory.ATP, "Australian Open")).isEqualTo("Grand Slam");
        assertThat(TournamentLevels.inferLevel(TournamentCategory.ATP, "Miami Masters")).isEqualTo("Masters 1000");
        assertThat(TournamentLevels.inferLevel(TournamentCategory.WTA, "Dubai 1000")).isEqualTo("WTA 1000");
        assertThat(TournamentLevels.inferLevel(TournamentCategory.UNKNOWN, "Wimbledon")).isNull();
    }
}
