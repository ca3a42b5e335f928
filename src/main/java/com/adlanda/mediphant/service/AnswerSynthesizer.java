package com.adlanda.mediphant.service;

import com.adlanda.mediphant.model.SearchMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns search matches into the answer text returned to the caller.
 *
 * With two or more matches a generative model is asked for a concise answer when one
 * is configured. Any generation failure falls back to the top match plus a
 * consultation note, so synthesis itself never fails.
 */
public class AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    public static final String NO_INFORMATION_ANSWER =
            "I don't have specific information about that topic. "
                    + "Please consult with a healthcare professional for medical guidance.";

    public static final String CONSULTATION_SUFFIX =
            "For additional guidance, consult with a healthcare professional.";

    private static final String PROMPT_TEMPLATE = """
            Based on the following medical information, provide a concise answer to the question: "%s"

            Context:
            %s

            Please provide a helpful, accurate response. If the context doesn't contain enough information, \
            say so and recommend consulting a healthcare professional.""";

    private final ChatModel chatModel;

    /**
     * @param chatModel Generative model, or {@code null} to always answer deterministically
     */
    public AnswerSynthesizer(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    public static AnswerSynthesizer deterministic() {
        return new AnswerSynthesizer(null);
    }

    /**
     * Builds the answer for a query.
     *
     * @param query              The user question
     * @param matches            Matches ordered best first
     * @param generationAllowed  Whether the generative model may be called for this request
     * @return The answer text, never {@code null}
     */
    public String synthesize(String query, List<SearchMatch> matches, boolean generationAllowed) {
        if (matches.isEmpty()) {
            return NO_INFORMATION_ANSWER;
        }
        if (matches.size() == 1) {
            return matches.get(0).text();
        }
        if (chatModel != null && generationAllowed) {
            String generated = generate(query, matches);
            if (generated != null) {
                return generated;
            }
        }
        return matches.get(0).text() + " " + CONSULTATION_SUFFIX;
    }

    public boolean isGenerative() {
        return chatModel != null;
    }

    private String generate(String query, List<SearchMatch> matches) {
        String context = matches.stream()
                .map(SearchMatch::text)
                .collect(Collectors.joining("\n\n"));
        try {
            String reply = chatModel.call(PROMPT_TEMPLATE.formatted(query, context));
            if (reply == null || reply.isBlank()) {
                log.warn("Answer generation returned no text; using top match");
                return null;
            }
            return reply.trim();
        } catch (RuntimeException e) {
            log.warn("Answer generation failed ({}); using top match", e.getClass().getSimpleName());
            return null;
        }
    }
}
