package com.adlanda.mediphant.controller;

import com.adlanda.mediphant.exception.InvalidQueryException;
import com.adlanda.mediphant.model.FaqResult;
import com.adlanda.mediphant.service.FaqService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.regex.Pattern;

/**
 * REST controller answering FAQ questions against the knowledge corpus.
 */
@RestController
@RequestMapping("/api/faq")
public class FaqController {

    static final String QUERY_REQUIRED = "Query parameter \"q\" is required";

    private static final Pattern EDGE_WHITESPACE =
            Pattern.compile("^[\\s\\uFEFF]+|[\\s\\uFEFF]+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final FaqService faqService;

    public FaqController(FaqService faqService) {
        this.faqService = faqService;
    }

    /**
     * Answer a question.
     *
     * @param query The question, passed as {@code q}
     * @return The answer and up to three supporting passages
     */
    @GetMapping
    public ResponseEntity<FaqResult> answer(@RequestParam(value = "q", required = false) String query) {
        String trimmed = query == null ? "" : EDGE_WHITESPACE.matcher(query).replaceAll("");
        if (trimmed.isEmpty()) {
            throw new InvalidQueryException(QUERY_REQUIRED);
        }
        return ResponseEntity.ok(faqService.answer(trimmed));
    }
}
