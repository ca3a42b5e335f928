package com.adlanda.mediphant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request body for recording an interaction check in the history log.
 *
 * Medication names may contain letters, digits, white space, hyphens and periods.
 */
public record HistoryRecordRequest(
        @NotBlank(message = "medA is required")
        @Size(max = 100, message = "Medication name too long")
        @Pattern(regexp = "(?U)^[a-zA-Z0-9\\s\\-.]+$", message = "Invalid characters in medication name")
        String medA,

        @NotBlank(message = "medB is required")
        @Size(max = 100, message = "Medication name too long")
        @Pattern(regexp = "(?U)^[a-zA-Z0-9\\s\\-.]+$", message = "Invalid characters in medication name")
        String medB,

        @JsonProperty("isRisky")
        boolean risky,

        String reason
) {
    public HistoryRecordRequest {
        if (reason == null) {
            reason = "";
        }
    }
}
