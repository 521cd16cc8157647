package com.upgradegate.gate;

/**
 * The semantic review could not produce a usable opinion. The safety gate
 * folds this into a denial; it is never surfaced to callers.
 */
public class SemanticReviewException extends RuntimeException {

    public SemanticReviewException(String message) {
        super(message);
    }

    public SemanticReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
