package com.adlanda.mediphant.controller;

import com.adlanda.mediphant.history.BoundedHistoryLog;
import com.adlanda.mediphant.ratelimit.RateLimiter;
import com.adlanda.mediphant.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HistoryController.class)
class HistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BoundedHistoryLog historyLog;

    @TestConfiguration
    static class TestConfig {
        @Bean
        public BoundedHistoryLog historyLog() {
            return new BoundedHistoryLog(10, new MutableClock(Instant.parse("2025-03-01T12:00:00Z")));
        }

        @Bean
        public RateLimiter rateLimiter() {
            return new RateLimiter(Duration.ofSeconds(60), 10_000, Clock.systemUTC());
        }
    }

    @BeforeEach
    void setUp() {
        historyLog.clear();
    }

    @Test
    void list_empty_returnsEmptyHistory() throws Exception {
        mockMvc.perform(get("/api/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.history").isArray())
                .andExpect(jsonPath("$.history").isEmpty());
    }

    @Test
    void record_thenList_returnsNewestFirst() throws Exception {
        historyLog.record("aspirin", "ibuprofen", false, "No interaction found");

        mockMvc.perform(post("/api/history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"medA": " warfarin ", "medB": "ibuprofen", "isRisky": true, "reason": "Bleeding risk"}
                            """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNotEmpty())
                .andExpect(jsonPath("$.medA").value("warfarin"))
                .andExpect(jsonPath("$.isRisky").value(true))
                .andExpect(jsonPath("$.timestamp").value("2025-03-01T12:00:00Z"));

        mockMvc.perform(get("/api/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.history.length()").value(2))
                .andExpect(jsonPath("$.history[0].medA").value("warfarin"))
                .andExpect(jsonPath("$.history[0].reason").value("Bleeding risk"))
                .andExpect(jsonPath("$.history[1].medA").value("aspirin"))
                .andExpect(jsonPath("$.history[1].isRisky").value(false));
    }

    @Test
    void record_missingMedication_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"medA": "warfarin", "medB": "  "}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"))
                .andExpect(jsonPath("$.details[0]").value("medB: medB is required"));

        assertThat(historyLog.size()).isZero();
    }

    @Test
    void record_invalidCharactersInName_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"medA": "warfarin; drop", "medB": "Co-Q10 2.5mg"}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.length()").value(1))
                .andExpect(jsonPath("$.details[0]").value("medA: Invalid characters in medication name"));

        assertThat(historyLog.size()).isZero();
    }

    @Test
    void record_unsupportedContentType_returnsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/history")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("warfarin and ibuprofen"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error").value("Unsupported Media Type"));

        assertThat(historyLog.size()).isZero();
    }

    @Test
    void record_malformedBody_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void clear_removesAllItems() throws Exception {
        historyLog.record("a", "b", false, "");
        historyLog.record("c", "d", true, "");

        mockMvc.perform(delete("/api/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("History cleared successfully"));

        assertThat(historyLog.list()).isEmpty();
    }

    @Test
    void clear_whenEmpty_succeeds() throws Exception {
        mockMvc.perform(delete("/api/history"))
                .andExpect(status().isOk());
    }
}
