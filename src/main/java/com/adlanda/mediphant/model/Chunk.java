package com.adlanda.mediphant.model;

/**
 * A single retrievable line of the knowledge corpus.
 *
 * @param id        Stable identifier derived from the ordinal ("chunk-0", "chunk-1", ...)
 * @param text      The trimmed line content
 * @param sourceRef Name of the corpus document the line came from
 * @param ordinal   Zero-based position in document order, used as the ranking tie-break
 */
public record Chunk(
        String id,
        String text,
        String sourceRef,
        int ordinal
) {
    private static final String ID_PREFIX = "chunk-";

    /**
     * Creates a chunk whose id is derived from its ordinal.
     */
    public static Chunk of(String text, String sourceRef, int ordinal) {
        return new Chunk(ID_PREFIX + ordinal, text, sourceRef, ordinal);
    }
}
