package com.upgradegate.gate;

import java.util.List;

/**
 * A well-formed reviewer opinion. Construction rejects anything malformed,
 * so holding an instance means every field was present and in range.
 */
public record ReviewResponse(boolean approve, String reason, double confidence, List<String> additionalChecks) {

    public ReviewResponse {
        if (reason == null || reason.isBlank()) {
            throw new SemanticReviewException("review response has no reason");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new SemanticReviewException("review confidence out of range: " + confidence);
        }
        additionalChecks = additionalChecks == null ? List.of() : List.copyOf(additionalChecks);
    }
}
