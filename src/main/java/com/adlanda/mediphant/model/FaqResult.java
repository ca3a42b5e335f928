package com.adlanda.mediphant.model;

import java.util.List;

/**
 * Response of the FAQ endpoint.
 *
 * @param answer  Synthesized answer text
 * @param matches Up to three supporting passages, best first
 */
public record FaqResult(
        String answer,
        List<SearchMatch> matches
) {
    public FaqResult {
        matches = List.copyOf(matches);
    }
}
