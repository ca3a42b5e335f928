package com.adlanda.mediphant.model;

/**
 * A passage returned by a search, with its relevance score.
 *
 * @param text  The passage text
 * @param score Match ratio in [0, 1] on the fallback path, backend similarity on the vector path
 */
public record SearchMatch(
        String text,
        double score
) {}
