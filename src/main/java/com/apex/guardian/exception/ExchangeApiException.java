package com.apex.guardian.exception;

/**
 * Non-retryable error returned by the exchange (rejected order, unknown symbol, insufficient margin).
 */
public class ExchangeApiException extends TradingException {
    private final int errorCode;

    public ExchangeApiException(String message) {
        super(message);
        this.errorCode = -1;
    }

    public ExchangeApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = -1;
    }

    public ExchangeApiException(String message, int errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
