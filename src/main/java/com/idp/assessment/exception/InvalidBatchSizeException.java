package com.idp.assessment.exception;

/**
 * A configured batch size is zero or negative.
 */
public class InvalidBatchSizeException extends ConfigurationException {

    public InvalidBatchSizeException(String setting, int value) {
        super("Batch size '" + setting + "' must be greater than 0 but was " + value);
    }
}
