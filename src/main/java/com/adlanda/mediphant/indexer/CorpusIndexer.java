package com.adlanda.mediphant.indexer;

import com.adlanda.mediphant.exception.UpstreamServiceException;
import com.adlanda.mediphant.model.Chunk;
import com.adlanda.mediphant.repository.VectorIndex;
import com.adlanda.mediphant.repository.VectorIndex.IndexStats;
import com.adlanda.mediphant.repository.VectorIndex.IndexedVector;
import com.adlanda.mediphant.service.CorpusChunker;
import com.adlanda.mediphant.service.EmbeddingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Offline job that embeds the corpus and loads it into the vector index.
 *
 * Indexing flow:
 * 1. Chunk the corpus document, one chunk per line
 * 2. Embed all chunks in one request
 * 3. Upsert the vectors in batches, checking every acknowledgement
 */
public class CorpusIndexer {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndexer.class);

    static final int UPSERT_BATCH_SIZE = 100;

    private final CorpusChunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;

    public CorpusIndexer(CorpusChunker chunker, EmbeddingService embeddingService, VectorIndex vectorIndex) {
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
    }

    /**
     * Checks that the vector index is reachable.
     */
    public IndexStats testConnection() {
        IndexStats stats = vectorIndex.describe();
        log.info("Vector index connection successful: dimension={}, vectors={}",
                stats.dimension(), stats.totalVectorCount());
        return stats;
    }

    /**
     * Indexes the whole corpus document.
     *
     * @param content   Corpus text
     * @param sourceRef Corpus name stored with every vector
     * @return Number of vectors upserted
     * @throws com.adlanda.mediphant.exception.EmptyCorpusException if the corpus has no content lines
     * @throws UpstreamServiceException if embedding or upserting fails or is only partly acknowledged
     */
    public int indexCorpus(String content, String sourceRef) {
        log.info("Starting corpus indexing: {} characters from {}", content.length(), sourceRef);

        List<Chunk> chunks = chunker.chunk(content, sourceRef);
        log.info("Created {} chunks", chunks.size());

        List<float[]> embeddings = embeddingService.embedAll(chunks.stream().map(Chunk::text).toList());

        List<IndexedVector> vectors = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            vectors.add(toVector(chunks.get(i), embeddings.get(i)));
        }

        int upserted = 0;
        for (int from = 0; from < vectors.size(); from += UPSERT_BATCH_SIZE) {
            List<IndexedVector> batch = vectors.subList(from, Math.min(from + UPSERT_BATCH_SIZE, vectors.size()));
            int acknowledged = vectorIndex.upsert(batch);
            if (acknowledged != batch.size()) {
                throw new UpstreamServiceException("Vector index acknowledged %d of %d vectors after %d were stored"
                        .formatted(acknowledged, batch.size(), upserted));
            }
            upserted += acknowledged;
        }

        log.info("Corpus indexing completed: {} vectors upserted", upserted);
        return upserted;
    }

    private static IndexedVector toVector(Chunk chunk, float[] embedding) {
        return new IndexedVector(chunk.id(), embedding, Map.of(
                "text", chunk.text(),
                "source", chunk.sourceRef(),
                "chunk_index", chunk.ordinal()
        ));
    }
}
