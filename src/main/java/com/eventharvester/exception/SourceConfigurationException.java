package com.eventharvester.exception;

/**
 * The declarative source configuration could not be loaded.
 */
public class SourceConfigurationException extends RuntimeException {

    public SourceConfigurationException(String message) {
        super(message);
    }

    public SourceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
