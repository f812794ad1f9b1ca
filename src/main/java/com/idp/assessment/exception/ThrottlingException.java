package com.idp.assessment.exception;

/**
 * The inference service rejected the call because of rate or quota limits.
 * The scheduler retries these with exponential backoff.
 */
public class ThrottlingException extends InvocationException {

    public ThrottlingException(String message) {
        super(message);
    }

    public ThrottlingException(String message, Throwable cause) {
        super(message, cause);
    }
}
