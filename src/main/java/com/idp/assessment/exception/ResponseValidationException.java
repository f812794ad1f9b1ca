package com.idp.assessment.exception;

/**
 * A task response is well formed but carries out-of-range values, such as a confidence outside [0, 1].
 */
public class ResponseValidationException extends ParsingException {

    public ResponseValidationException(String message) {
        super(message);
    }
}
