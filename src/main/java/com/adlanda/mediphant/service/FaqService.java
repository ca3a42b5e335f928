package com.adlanda.mediphant.service;

import com.adlanda.mediphant.model.FaqResult;
import com.adlanda.mediphant.model.OrchestratorMode;
import com.adlanda.mediphant.model.SearchMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers one FAQ question: retrieve matches, then synthesize the answer.
 */
@Service
public class FaqService {

    private static final Logger log = LoggerFactory.getLogger(FaqService.class);

    private final SearchOrchestrator orchestrator;
    private final AnswerSynthesizer synthesizer;

    public FaqService(SearchOrchestrator orchestrator, AnswerSynthesizer synthesizer) {
        this.orchestrator = orchestrator;
        this.synthesizer = synthesizer;
    }

    public FaqResult answer(String query) {
        long startTime = System.currentTimeMillis();

        List<SearchMatch> matches = orchestrator.search(query);
        OrchestratorMode mode = orchestrator.mode();
        String answer = synthesizer.synthesize(query, matches, mode == OrchestratorMode.VECTOR_READY);

        log.debug("FAQ query '{}' answered with {} matches in {}ms ({})",
                truncate(query, 50), matches.size(), System.currentTimeMillis() - startTime, mode);

        return new FaqResult(answer, matches);
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
