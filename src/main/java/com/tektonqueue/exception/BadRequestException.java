package com.tektonqueue.exception;

/**
 * Exception thrown when the admitted object itself is malformed.
 */
public class BadRequestException extends TektonQueueException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
