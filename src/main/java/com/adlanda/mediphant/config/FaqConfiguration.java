package com.adlanda.mediphant.config;

import com.adlanda.mediphant.history.BoundedHistoryLog;
import com.adlanda.mediphant.model.CredentialStatus;
import com.adlanda.mediphant.model.ExternalServicesSettings;
import com.adlanda.mediphant.model.OrchestratorMode;
import com.adlanda.mediphant.ratelimit.RateLimiter;
import com.adlanda.mediphant.service.AnswerSynthesizer;
import com.adlanda.mediphant.service.CorpusChunker;
import com.adlanda.mediphant.service.CorpusSnapshot;
import com.adlanda.mediphant.service.CorpusSource;
import com.adlanda.mediphant.service.LexicalFallbackSearch;
import com.adlanda.mediphant.service.SearchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Creates the process-wide services: corpus, orchestrator, synthesizer, rate limiter
 * and history log. Each is built once here and injected where needed.
 */
@Configuration
public class FaqConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FaqConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CorpusSnapshot corpusSnapshot(CorpusSource corpusSource, CorpusChunker chunker) {
        CorpusSource.Document document = corpusSource.read();
        CorpusSnapshot snapshot = new CorpusSnapshot(
                document.sourceRef(), chunker.chunk(document.content(), document.sourceRef()));
        log.info("Loaded {} corpus chunks from {}", snapshot.size(), snapshot.sourceRef());
        return snapshot;
    }

    /**
     * Starts on the vector path only when both credentials are present and both
     * clients could be built; otherwise the fallback search is used from the start.
     */
    @Bean
    public SearchOrchestrator searchOrchestrator(ExternalClientFactory clientFactory,
                                                 LexicalFallbackSearch fallbackSearch) {
        ExternalServicesSettings settings = clientFactory.settings();
        if (settings.initialMode() == OrchestratorMode.VECTOR_READY) {
            try {
                return SearchOrchestrator.vectorReady(
                        clientFactory.createEmbeddingService(),
                        clientFactory.createVectorIndex(),
                        fallbackSearch);
            } catch (RuntimeException e) {
                log.warn("Failed to initialize external search clients, using fallback search: {}",
                        e.getClass().getSimpleName());
            }
        } else {
            log.warn("Missing credentials (embedding: {}, vector index: {}), using fallback search",
                    settings.embeddingCredential(), settings.vectorCredential());
        }
        return SearchOrchestrator.fallbackOnly(fallbackSearch);
    }

    @Bean
    public AnswerSynthesizer answerSynthesizer(ExternalClientFactory clientFactory) {
        if (clientFactory.settings().embeddingCredential() == CredentialStatus.ABSENT) {
            return AnswerSynthesizer.deterministic();
        }
        try {
            return new AnswerSynthesizer(clientFactory.createChatModel());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize answer generation, using deterministic answers: {}",
                    e.getClass().getSimpleName());
            return AnswerSynthesizer.deterministic();
        }
    }

    @Bean
    public RateLimiter rateLimiter(FaqProperties properties, Clock clock) {
        FaqProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimiter(rateLimit.getWindow(), rateLimit.getCapacity(), clock);
    }

    @Bean
    public BoundedHistoryLog historyLog(FaqProperties properties, Clock clock) {
        return new BoundedHistoryLog(properties.getHistory().getCapacity(), clock);
    }
}
