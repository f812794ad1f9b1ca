package com.idp.assessment.exception;

/**
 * Generic failure of a call to the inference service. Marks the task as failed without retry.
 */
public class InvocationException extends AssessmentException {

    public InvocationException(String message) {
        super(message);
    }

    public InvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
