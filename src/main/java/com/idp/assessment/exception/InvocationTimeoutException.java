package com.idp.assessment.exception;

/**
 * The inference call did not answer in time. Never retried.
 */
public class InvocationTimeoutException extends InvocationException {

    public InvocationTimeoutException(String message) {
        super(message);
    }

    public InvocationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
