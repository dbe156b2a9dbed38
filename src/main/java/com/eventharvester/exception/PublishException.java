package com.eventharvester.exception;

/**
 * Failure of the downstream write path (ingestion endpoint or backing store).
 */
public class PublishException extends RuntimeException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
