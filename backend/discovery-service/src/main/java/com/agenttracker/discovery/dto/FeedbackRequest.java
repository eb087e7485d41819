package com.agenttracker.discovery.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Feedback on a discovery. Absent fields leave the stored value as is.
 */
public record FeedbackRequest(
        Boolean useful,
        @Size(max = 2048) String notes,
        @Min(1) @Max(5) Integer relevance
) {
}
