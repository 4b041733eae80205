package com.heroespath.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heroespath.service.review.ReviewOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewResponse {
    private ReviewOutcome.Type outcome;
    private DiscoveryResponse discovery;
    private String warning;

    public static ReviewResponse from(ReviewOutcome outcome) {
        return new ReviewResponse(
                outcome.getType(),
                DiscoveryResponse.from(outcome.getDiscovery()),
                outcome.getWarningIfAny().map(w -> "DegradedPersistence: " + w.getReason()).orElse(null));
    }
}
