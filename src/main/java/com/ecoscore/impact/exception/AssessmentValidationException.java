package com.ecoscore.impact.exception;

/**
 * Raised when an assessment request is rejected before scoring.
 */
public class AssessmentValidationException extends RuntimeException {

    public AssessmentValidationException(String message) {
        super(message);
    }
}
