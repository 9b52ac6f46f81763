package com.apex.guardian.exception;

/**
 * Timeout, rate limit or 5xx from the exchange. Safe to retry with backoff.
 */
public class ExchangeTransientException extends ExchangeApiException {
    public ExchangeTransientException(String message) {
        super(message);
    }

    public ExchangeTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
