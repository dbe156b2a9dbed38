package com.eventharvester.exception;

import lombok.Getter;

/**
 * Raised when a document cannot be retrieved: non-2xx status, timeout or connection failure.
 * <p>
 * Ошибка загрузки документа. Повторяется клиентом согласно политике повторов,
 * после исчерпания попыток окно или источник пропускается.
 */
@Getter
public class FetchException extends Exception {

    private final String url;
    private final int statusCode; // 0, если HTTP-статус неизвестен

    public FetchException(String url, String message) {
        this(url, 0, message, null);
    }

    public FetchException(String url, String message, Throwable cause) {
        this(url, 0, message, cause);
    }

    public FetchException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode > 0;
    }
}
