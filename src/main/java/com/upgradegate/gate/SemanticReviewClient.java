package com.upgradegate.gate;

/**
 * Transport to the external semantic-review service.
 */
public interface SemanticReviewClient {

    /**
     * @throws SemanticReviewException when the service is unreachable or answers with a malformed body
     */
    ReviewResponse review(ReviewRequest request);
}
