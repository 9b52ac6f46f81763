package com.apex.guardian.exception;

public class PositionConflictException extends TradingException {
    public PositionConflictException(String message) {
        super(message);
    }
}
