package com.tennis.api.controller;

import com.tennis.api.dto.RankingEntry;
import com.tennis.api.dto.RankingsResponse;
import com.tennis.api.exception.ResourceNotFoundException;
import com.tennis.api.service.HistoricalDataService;
import com.tennis.api.service.PlayerProfileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HistoricalDataController.class)
class HistoricalDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HistoricalDataService historicalDataService;

    @MockBean
    private PlayerProfileService playerProfileService;

    @Test
    void getRankings_isCachedForAnHour() throws Exception {
        when(historicalDataService.getRankings(10, null)).thenReturn(new RankingsResponse("atp", "2024-05-27", 2024, 1,
                List.of(new RankingEntry(1, 9525, "206173", "Jannik Sinner", "J. Sinner", "ITA", "IT"))));

        mockMvc.perform(get("/api/data/rankings").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=3600"))
                .andExpect(jsonPath("$.rankingDate").value("2024-05-27"))
                .andExpect(jsonPath("$.rankings[0].name").value("Jannik Sinner"));
    }

    @Test
    void getRankings_badDate_isBadRequest() throws Exception {
        when(historicalDataService.getRankings(null, "yesterday"))
                .thenThrow(new IllegalArgumentException("Invalid ranking date: yesterday"));

        mockMvc.perform(get("/api/data/rankings").param("date", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("Invalid ranking date: yesterday"));
    }

    @Test
    void getPlayer_unknown_isNotFound() throws Exception {
        when(playerProfileService.getProfile("1")).thenThrow(new ResourceNotFoundException("Player", "1"));

        mockMvc.perform(get("/api/data/players/1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Player not found: 1"))
                .andExpect(jsonPath("$.path").value("/api/data/players/1"));
    }

    @Test
    void unknownRoute_isNotFoundError() throws Exception {
        mockMvc.perform(get("/api/data/tournaments"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("No endpoint at /api/data/tournaments"));
    }

    @Test
    void getPerformance_nonNumericYears_isInvalidParameter() throws Exception {
        mockMvc.perform(get("/api/data/players/206173/performance").param("years", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));

        verify(playerProfileService, never()).getPerformance(eq("206173"), anyInt());
    }

    @Test
    void getHeadToHead_missingPlayer_isMissingParameter() throws Exception {
        mockMvc.perform(get("/api/data/head-to-head").param("player1", "206173"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_PARAMETER"))
                .andExpect(jsonPath("$.message").value("Missing required parameter: player2"));
    }

    @Test
    void getMatchesByDate_formatted_usesDisplayViews() throws Exception {
        when(historicalDataService.getFormattedMatchesByDate("2024-01-15", false)).thenReturn(List.of());

        mockMvc.perform(get("/api/data/matches/2024-01-15").param("formatted", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(historicalDataService, never()).getMatchesByDate("2024-01-15");
    }

    @Test
    void clearCache_isNoContent() throws Exception {
        mockMvc.perform(delete("/api/data/cache"))
                .andExpect(status().isNoContent());

        verify(historicalDataService).clearCache();
    }
}
