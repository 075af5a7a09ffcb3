package com.tektonqueue.exception;

/**
 * Exception thrown when a key or value violates Kubernetes naming rules.
 */
public class ValidationException extends TektonQueueException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
