package com.adlanda.mediphant.health;

import com.adlanda.mediphant.model.OrchestratorMode;
import com.adlanda.mediphant.service.AnswerSynthesizer;
import com.adlanda.mediphant.service.CorpusSnapshot;
import com.adlanda.mediphant.service.SearchOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the FAQ search path.
 *
 * Always UP, since the fallback search answers without external services. Reports:
 * - The current orchestrator mode
 * - Whether answers may be generated
 * - Number of corpus chunks available to the fallback search
 */
@Component("searchMode")
public class SearchModeHealthIndicator implements HealthIndicator {

    private final SearchOrchestrator orchestrator;
    private final AnswerSynthesizer synthesizer;
    private final CorpusSnapshot corpus;

    public SearchModeHealthIndicator(SearchOrchestrator orchestrator, AnswerSynthesizer synthesizer,
                                     CorpusSnapshot corpus) {
        this.orchestrator = orchestrator;
        this.synthesizer = synthesizer;
        this.corpus = corpus;
    }

    @Override
    public Health health() {
        OrchestratorMode mode = orchestrator.mode();
        return Health.up()
                .withDetail("mode", mode.name())
                .withDetail("degraded", mode == OrchestratorMode.FALLBACK_ONLY)
                .withDetail("generativeAnswers", synthesizer.isGenerative() && mode == OrchestratorMode.VECTOR_READY)
                .withDetail("corpusChunks", corpus.size())
                .build();
    }
}
