package com.eventharvester.exception;

/**
 * Failure while extracting a single field or item from a fetched document.
 * Callers treat the field or item as absent and carry on with the batch.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
