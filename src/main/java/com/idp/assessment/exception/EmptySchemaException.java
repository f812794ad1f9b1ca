package com.idp.assessment.exception;

/**
 * Neither the schema nor the extraction result yields a single assessable leaf.
 */
public class EmptySchemaException extends AssessmentException {

    public EmptySchemaException(String message) {
        super(message);
    }
}
