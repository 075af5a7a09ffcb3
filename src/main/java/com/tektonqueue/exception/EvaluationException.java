package com.tektonqueue.exception;

/**
 * Exception thrown when a compiled program fails against a PipelineRun.
 * The admission request is rejected and nothing is applied.
 */
public class EvaluationException extends TektonQueueException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
