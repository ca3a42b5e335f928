package com.adlanda.mediphant.service;

import com.adlanda.mediphant.model.Chunk;
import com.adlanda.mediphant.model.SearchMatch;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Term-overlap search over the in-memory corpus. Needs no external service.
 *
 * A query term matches a chunk when it is a substring of one of the chunk's terms
 * or contains one of them. The score of a chunk is the fraction of query terms that
 * match. Chunks scoring zero are dropped; the rest are ordered by score, then by
 * corpus position.
 */
@Service
public class LexicalFallbackSearch {

    public static final int MAX_MATCHES = 3;

    // Unicode white space, including no-break space and the byte order mark
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<ScoredChunk> RANKING =
            Comparator.comparingDouble(ScoredChunk::score).reversed()
                    .thenComparingInt(sc -> sc.chunk().ordinal());

    private final List<IndexedChunk> chunks;

    public LexicalFallbackSearch(CorpusSnapshot corpus) {
        this.chunks = corpus.chunks().stream()
                .map(chunk -> new IndexedChunk(chunk, tokenize(chunk.text())))
                .toList();
    }

    /**
     * Ranks the corpus against the query.
     *
     * A query without any term matches nothing.
     *
     * @param query The user question
     * @return At most {@value #MAX_MATCHES} matches, best first
     */
    public List<SearchMatch> search(String query) {
        List<String> queryTerms = tokenize(query);
        if (queryTerms.isEmpty()) {
            return List.of();
        }

        return chunks.stream()
                .map(indexed -> new ScoredChunk(indexed.chunk(), score(queryTerms, indexed.terms())))
                .filter(sc -> sc.score() > 0)
                .sorted(RANKING)
                .limit(MAX_MATCHES)
                .map(sc -> new SearchMatch(sc.chunk().text(), sc.score()))
                .toList();
    }

    /**
     * Fraction of query terms that share a substring relation with at least one chunk term.
     */
    static double score(List<String> queryTerms, List<String> chunkTerms) {
        long matched = queryTerms.stream()
                .filter(term -> chunkTerms.stream()
                        .anyMatch(chunkTerm -> chunkTerm.contains(term) || term.contains(chunkTerm)))
                .count();
        return (double) matched / queryTerms.size();
    }

    static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(text.toLowerCase(Locale.ROOT)))
                .filter(term -> !term.isEmpty())
                .toList();
    }

    private record IndexedChunk(Chunk chunk, List<String> terms) {}

    private record ScoredChunk(Chunk chunk, double score) {}
}
