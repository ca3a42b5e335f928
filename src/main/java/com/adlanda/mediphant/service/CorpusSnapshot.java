package com.adlanda.mediphant.service;

import com.adlanda.mediphant.model.Chunk;

import java.util.List;

/**
 * The chunked corpus the fallback search ranks against. Loaded once at startup.
 *
 * @param sourceRef Name of the corpus document
 * @param chunks    Chunks in ordinal order
 */
public record CorpusSnapshot(
        String sourceRef,
        List<Chunk> chunks
) {
    public CorpusSnapshot {
        chunks = List.copyOf(chunks);
    }

    public int size() {
        return chunks.size();
    }
}
