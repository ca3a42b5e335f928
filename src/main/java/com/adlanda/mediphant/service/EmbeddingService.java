package com.adlanda.mediphant.service;

import com.adlanda.mediphant.exception.UpstreamServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;

/**
 * Generates vector embeddings from text.
 *
 * Uses Spring AI's EmbeddingModel to call OpenAI's embedding API. Every failure,
 * timeouts included, surfaces as {@link UpstreamServiceException}.
 */
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;

    public EmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text The text to embed
     * @return The embedding vector
     */
    public float[] embed(String text) {
        float[] embedding;
        try {
            embedding = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new UpstreamServiceException("Embedding request failed", e);
        }
        if (embedding == null || embedding.length == 0) {
            throw new UpstreamServiceException("Embedding provider returned an empty vector");
        }
        return embedding;
    }

    /**
     * Embeds a batch of texts in one request.
     *
     * @param texts Texts to embed
     * @return One vector per input text, in input order
     */
    public List<float[]> embedAll(List<String> texts) {
        log.info("Generating embeddings for {} texts...", texts.size());

        List<float[]> embeddings;
        try {
            embeddings = embeddingModel.embed(texts);
        } catch (RuntimeException e) {
            throw new UpstreamServiceException("Batch embedding request failed", e);
        }

        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new UpstreamServiceException("Expected %d embeddings but received %d"
                    .formatted(texts.size(), embeddings == null ? 0 : embeddings.size()));
        }

        log.info("Generated {} embeddings", embeddings.size());
        return embeddings;
    }
}
