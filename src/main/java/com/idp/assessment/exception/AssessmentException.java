package com.idp.assessment.exception;

/**
 * Base type for every failure raised by the assessment engine.
 * Fatal subclasses abort a run before dispatch; per-task subclasses are caught by the scheduler.
 */
public abstract class AssessmentException extends RuntimeException {

    protected AssessmentException(String message) {
        super(message);
    }

    protected AssessmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
