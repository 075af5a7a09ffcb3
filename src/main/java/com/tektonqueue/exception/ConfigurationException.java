package com.tektonqueue.exception;

/**
 * Exception thrown when a configuration document is invalid.
 * At startup this fails fast; on reload the previous configuration stays in effect.
 */
public class ConfigurationException extends TektonQueueException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
