package com.apex.guardian.exception;

public class MarketDataUnavailableException extends TradingException {
    public MarketDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
