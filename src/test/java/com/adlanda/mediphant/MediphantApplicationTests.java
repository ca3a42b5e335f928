package com.adlanda.mediphant;

import com.adlanda.mediphant.model.OrchestratorMode;
import com.adlanda.mediphant.service.AnswerSynthesizer;
import com.adlanda.mediphant.service.SearchOrchestrator;
import com.adlanda.mediphant.support.TestCorpus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
    "faq.openai.api-key=",
    "faq.pinecone.api-key="  // No credentials: fallback search only
})
class MediphantApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SearchOrchestrator orchestrator;

    @Test
    void contextLoads_withoutCredentials_inFallbackMode() {
        assertThat(orchestrator.mode()).isEqualTo(OrchestratorMode.FALLBACK_ONLY);
    }

    @Test
    void faq_answersFromBundledCorpus() throws Exception {
        mockMvc.perform(get("/api/faq").param("q", "medication adherence diabetes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches[0].text").value(TestCorpus.ADHERENCE))
                .andExpect(jsonPath("$.matches[0].score").value(1.0))
                .andExpect(jsonPath("$.answer").value(TestCorpus.ADHERENCE + " " + AnswerSynthesizer.CONSULTATION_SUFFIX));
    }

    @Test
    void faq_unknownTopic_returnsDisclaimer() throws Exception {
        mockMvc.perform(get("/api/faq").param("q", "zzxxyy nonexistent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches").isEmpty())
                .andExpect(jsonPath("$.answer").value(AnswerSynthesizer.NO_INFORMATION_ANSWER));
    }

    @Test
    void health_reportsSearchMode() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.searchMode.details.mode").value("FALLBACK_ONLY"))
                .andExpect(jsonPath("$.components.searchMode.details.corpusChunks").value(5));
    }
}
