package com.adlanda.mediphant.service;

import com.adlanda.mediphant.exception.UpstreamServiceException;
import com.adlanda.mediphant.model.OrchestratorMode;
import com.adlanda.mediphant.model.SearchMatch;
import com.adlanda.mediphant.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chooses between vector search and the lexical fallback for each query.
 *
 * Orchestrates the query flow:
 * 1. While VECTOR_READY, embed the query and ask the vector index for neighbors
 * 2. If that fails, switch this instance to FALLBACK_ONLY for good
 * 3. Answer from the lexical fallback whenever the vector path is unavailable
 *
 * The switch is never undone, even if the external services recover.
 */
public class SearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final LexicalFallbackSearch fallbackSearch;
    private final AtomicReference<OrchestratorMode> mode;

    private SearchOrchestrator(EmbeddingService embeddingService, VectorIndex vectorIndex,
                               LexicalFallbackSearch fallbackSearch, OrchestratorMode initialMode) {
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.fallbackSearch = Objects.requireNonNull(fallbackSearch, "fallbackSearch");
        this.mode = new AtomicReference<>(initialMode);
    }

    /**
     * Creates an orchestrator that starts on the vector path.
     */
    public static SearchOrchestrator vectorReady(EmbeddingService embeddingService, VectorIndex vectorIndex,
                                                 LexicalFallbackSearch fallbackSearch) {
        return new SearchOrchestrator(
                Objects.requireNonNull(embeddingService, "embeddingService"),
                Objects.requireNonNull(vectorIndex, "vectorIndex"),
                fallbackSearch,
                OrchestratorMode.VECTOR_READY);
    }

    /**
     * Creates an orchestrator that only ever uses the lexical fallback.
     */
    public static SearchOrchestrator fallbackOnly(LexicalFallbackSearch fallbackSearch) {
        return new SearchOrchestrator(null, null, fallbackSearch, OrchestratorMode.FALLBACK_ONLY);
    }

    /**
     * Finds the passages most relevant to the query. Never fails because of an external service.
     *
     * @param query The user question
     * @return At most three matches, best first
     */
    public List<SearchMatch> search(String query) {
        if (mode.get() == OrchestratorMode.VECTOR_READY) {
            VectorSearchOutcome outcome = searchVectors(query);
            if (outcome instanceof VectorSearchOutcome.Matches found) {
                return found.matches();
            }
            downgrade(((VectorSearchOutcome.NeedsFallback) outcome).reason());
        }
        return fallbackSearch.search(query);
    }

    public OrchestratorMode mode() {
        return mode.get();
    }

    VectorSearchOutcome searchVectors(String query) {
        try {
            float[] queryEmbedding = embeddingService.embed(query);
            List<SearchMatch> matches = vectorIndex.query(queryEmbedding, LexicalFallbackSearch.MAX_MATCHES).stream()
                    .filter(neighbor -> neighbor.text() != null && !neighbor.text().isBlank())
                    .limit(LexicalFallbackSearch.MAX_MATCHES)
                    .map(neighbor -> new SearchMatch(neighbor.text(), neighbor.score()))
                    .toList();
            log.debug("Vector search for '{}' returned {} matches", truncate(query, 50), matches.size());
            return new VectorSearchOutcome.Matches(matches);
        } catch (UpstreamServiceException e) {
            return new VectorSearchOutcome.NeedsFallback(describe(e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure in vector search client", e);
            return new VectorSearchOutcome.NeedsFallback(describe(e));
        }
    }

    private void downgrade(String reason) {
        if (mode.compareAndSet(OrchestratorMode.VECTOR_READY, OrchestratorMode.FALLBACK_ONLY)) {
            log.warn("Vector search failed ({}); switching to fallback search for the rest of this process", reason);
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return e.getMessage() + ": " + cause.getClass().getSimpleName();
    }

    private static String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
