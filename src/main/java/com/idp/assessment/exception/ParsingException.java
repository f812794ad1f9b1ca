package com.idp.assessment.exception;

/**
 * A task response could not be read or does not have the structure the task expects.
 */
public class ParsingException extends AssessmentException {

    public ParsingException(String message) {
        super(message);
    }

    public ParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
