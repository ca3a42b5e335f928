package com.adlanda.mediphant.controller;

import com.adlanda.mediphant.ratelimit.RateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApiController.class)
class ApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @TestConfiguration
    static class TestConfig {
        @Bean
        public RateLimiter rateLimiter() {
            return new RateLimiter(Clock.systemUTC());
        }
    }

    @Test
    void rootEndpoint_returnsServiceInfo() throws Exception {
        mockMvc.perform(get("/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Mediphant FAQ"))
                .andExpect(jsonPath("$.endpoints").exists());
    }

    @Test
    void rootEndpoint_includesAllEndpoints() throws Exception {
        mockMvc.perform(get("/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints.faq").exists())
                .andExpect(jsonPath("$.endpoints.history").exists())
                .andExpect(jsonPath("$.endpoints.clearHistory").exists())
                .andExpect(jsonPath("$.endpoints.health").exists());
    }
}
