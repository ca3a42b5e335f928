package com.adlanda.mediphant.service;

import com.adlanda.mediphant.exception.EmptyCorpusException;
import com.adlanda.mediphant.model.Chunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a corpus document into chunks, one per content line.
 *
 * Blank lines, markdown headings and markup-only lines (rules, fences, quote markers)
 * are skipped. Lines are never merged or split further.
 */
@Service
public class CorpusChunker {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern MARKUP_ONLY = Pattern.compile("[-*_=#>|`~\\s]+");

    /**
     * Chunks the given document.
     *
     * @param content   Raw document text
     * @param sourceRef Name recorded on every chunk
     * @return Chunks in document order with ordinals 0..n-1
     * @throws EmptyCorpusException if no content line remains
     */
    public List<Chunk> chunk(String content, String sourceRef) {
        List<Chunk> chunks = new ArrayList<>();
        if (content == null) {
            throw new EmptyCorpusException(sourceRef);
        }

        for (String line : LINE_BREAK.split(content)) {
            String trimmed = line.trim();
            if (isSkipped(trimmed)) {
                continue;
            }
            chunks.add(Chunk.of(trimmed, sourceRef, chunks.size()));
        }

        if (chunks.isEmpty()) {
            throw new EmptyCorpusException(sourceRef);
        }
        return List.copyOf(chunks);
    }

    private boolean isSkipped(String trimmed) {
        return trimmed.isEmpty()
                || trimmed.startsWith("#")
                || MARKUP_ONLY.matcher(trimmed).matches();
    }
}
