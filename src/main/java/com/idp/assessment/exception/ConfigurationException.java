package com.idp.assessment.exception;

/**
 * Invalid engine configuration: missing prompt template, misplaced placeholders,
 * a wrong number of cache-split markers or out-of-range numeric settings.
 * Always raised before any task is dispatched.
 */
public class ConfigurationException extends AssessmentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
