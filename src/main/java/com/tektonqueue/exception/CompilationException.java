package com.tektonqueue.exception;

/**
 * Exception thrown when an expression list cannot be compiled.
 */
public class CompilationException extends TektonQueueException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
