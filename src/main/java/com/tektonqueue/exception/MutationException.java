package com.tektonqueue.exception;

/**
 * Exception thrown when a mutation cannot be applied.
 * The PipelineRun may be left partially mutated and must not be persisted.
 */
public class MutationException extends TektonQueueException {

    public MutationException(String message) {
        super(message);
    }

    public MutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
