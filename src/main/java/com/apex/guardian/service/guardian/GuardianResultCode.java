package com.apex.guardian.service.guardian;

public enum GuardianResultCode {
    APPLIED,
    NO_CHANGE,
    CLOSED,
    HALF_CLOSED,
    NO_POSITION,
    LOOSER_STOP_REJECTED,
    INVALID_STOP_PLACEMENT,
    INVALID_TARGET_PLACEMENT,
    INVALID_QUANTITY,
    CONFLICT,
    EXCHANGE_ERROR,
    MARKET_DATA_UNAVAILABLE,
    STATE_UNAVAILABLE,
    GUARDIAN_DISABLED,
    HALF_CLOSE_DISABLED
}
