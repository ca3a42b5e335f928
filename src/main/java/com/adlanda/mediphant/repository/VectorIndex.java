package com.adlanda.mediphant.repository;

import java.util.List;
import java.util.Map;

/**
 * External vector index holding the embedded corpus.
 *
 * Implementations report every failure as
 * {@link com.adlanda.mediphant.exception.UpstreamServiceException}.
 */
public interface VectorIndex {

    /**
     * Returns the nearest stored vectors, most similar first.
     *
     * @param vector Query embedding
     * @param topK   Maximum number of neighbors
     */
    List<VectorNeighbor> query(float[] vector, int topK);

    /**
     * Inserts or replaces vectors by id.
     *
     * @return Number of vectors the backend acknowledged
     */
    int upsert(List<IndexedVector> vectors);

    /**
     * Reads index statistics; doubles as a connectivity check.
     */
    IndexStats describe();

    /**
     * A vector to store, with the metadata returned on query.
     */
    record IndexedVector(String id, float[] values, Map<String, Object> metadata) {}

    /**
     * A stored vector returned by a query. {@code text} is empty when the metadata had none.
     */
    record VectorNeighbor(String id, double score, String text) {}

    record IndexStats(int dimension, long totalVectorCount) {}
}
