package com.tektonqueue.exception;

/**
 * Base exception for tekton-queue.
 */
public class TektonQueueException extends RuntimeException {

    public TektonQueueException(String message) {
        super(message);
    }

    public TektonQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
