package com.adlanda.mediphant.controller;

import com.adlanda.mediphant.model.FaqResult;
import com.adlanda.mediphant.model.SearchMatch;
import com.adlanda.mediphant.ratelimit.RateLimiter;
import com.adlanda.mediphant.service.FaqService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FaqController.class)
class FaqControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FaqService faqService;

    @TestConfiguration
    static class TestConfig {
        @Bean
        public RateLimiter rateLimiter() {
            return new RateLimiter(Duration.ofSeconds(60), 10_000, Clock.systemUTC());
        }
    }

    @Test
    void answer_validQuery_returnsAnswerAndMatches() throws Exception {
        FaqResult result = new FaqResult("Keep a routine.", List.of(
                new SearchMatch("Keep a routine.", 0.91),
                new SearchMatch("Use reminders.", 0.45)));
        when(faqService.answer("how to stay adherent")).thenReturn(result);

        mockMvc.perform(get("/api/faq").param("q", "how to stay adherent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Keep a routine."))
                .andExpect(jsonPath("$.matches.length()").value(2))
                .andExpect(jsonPath("$.matches[0].text").value("Keep a routine."))
                .andExpect(jsonPath("$.matches[0].score").value(0.91));
    }

    @Test
    void answer_trimsQuery() throws Exception {
        when(faqService.answer("diuretics")).thenReturn(new FaqResult("x", List.of()));

        mockMvc.perform(get("/api/faq").param("q", "   diuretics  "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("x"))
                .andExpect(jsonPath("$.matches").isEmpty());
    }

    @Test
    void answer_missingQuery_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/faq"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query parameter \"q\" is required"));

        verifyNoInteractions(faqService);
    }

    @Test
    void answer_blankQuery_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/faq").param("q", "   "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query parameter \"q\" is required"));

        verifyNoInteractions(faqService);
    }

    @Test
    void answer_noBreakSpaceOnlyQuery_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/faq").param("q", "\u00A0\u2003\uFEFF"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query parameter \"q\" is required"));

        verifyNoInteractions(faqService);
    }

    @Test
    void answer_trimsUnicodeWhitespace() throws Exception {
        when(faqService.answer("pill organizer")).thenReturn(new FaqResult("x", List.of()));

        mockMvc.perform(get("/api/faq").param("q", "\u00A0pill organizer\u00A0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("x"));
    }

    @Test
    void answer_post_returnsMethodNotAllowed() throws Exception {
        mockMvc.perform(post("/api/faq").param("q", "adherence"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().exists("Allow"))
                .andExpect(jsonPath("$.error").value("Method not allowed. Use GET with query parameter \"q\"."));
    }

    @Test
    void answer_unexpectedFailure_returnsSafeBody() throws Exception {
        when(faqService.answer(anyString())).thenThrow(new IllegalStateException("connection pool exhausted"));

        mockMvc.perform(get("/api/faq").param("q", "adherence"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error"))
                .andExpect(jsonPath("$.answer").value(ApiExceptionHandler.SAFE_FAQ_ANSWER))
                .andExpect(jsonPath("$.matches").isEmpty())
                .andExpect(content().string(not(containsString("connection pool"))));
    }

    @Test
    void answer_setsRateLimitHeaders() throws Exception {
        when(faqService.answer(anyString())).thenReturn(new FaqResult("x", List.of()));

        mockMvc.perform(get("/api/faq").param("q", "adherence").header("X-Forwarded-For", "198.51.100.20"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Limit", "10000"))
                .andExpect(header().string("X-RateLimit-Remaining", "9999"));
    }
}
