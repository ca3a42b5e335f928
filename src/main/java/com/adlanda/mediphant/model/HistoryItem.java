package com.adlanda.mediphant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One recorded medication interaction check.
 *
 * @param id        Random identifier
 * @param medA      First medication name
 * @param medB      Second medication name
 * @param risky     Whether the pair was flagged as potentially risky
 * @param reason    Explanation shown to the user
 * @param timestamp When the check was recorded
 */
public record HistoryItem(
        String id,
        String medA,
        String medB,
        @JsonProperty("isRisky") boolean risky,
        String reason,
        Instant timestamp
) {}
