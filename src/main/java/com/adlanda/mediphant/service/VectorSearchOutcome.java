package com.adlanda.mediphant.service;

import com.adlanda.mediphant.model.SearchMatch;

import java.util.List;

/**
 * Result of one attempt at the vector search path.
 */
public sealed interface VectorSearchOutcome {

    /**
     * The vector path answered.
     */
    record Matches(List<SearchMatch> matches) implements VectorSearchOutcome {
        public Matches {
            matches = List.copyOf(matches);
        }
    }

    /**
     * The vector path failed and the caller should use the fallback search.
     */
    record NeedsFallback(String reason) implements VectorSearchOutcome {}
}
