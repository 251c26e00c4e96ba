package com.tennis.api.controller;

import com.tennis.api.service.HistoricalDataService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HistoricalDataService historicalDataService;

    @MockBean
    private Clock clock;

    @Test
    void health_reportsArchiveAvailability() throws Exception {
        when(clock.instant()).thenReturn(Instant.parse("2024-06-01T00:00:00Z"));
        when(historicalDataService.getDataDirectory()).thenReturn("/srv/tennis");
        when(historicalDataService.isDataAvailable()).thenReturn(false);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.dataDirectory").value("/srv/tennis"))
                .andExpect(jsonPath("$.dataAvailable").value(false));
    }
}
