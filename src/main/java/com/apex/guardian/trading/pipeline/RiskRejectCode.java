package com.apex.guardian.trading.pipeline;

public enum RiskRejectCode {
    TIER_REJECTED,
    OUTSIDE_SCHEDULE,
    CIRCUIT_BREAKER_ACTIVE,
    RECENT_DUPLICATE,
    POSITION_ALREADY_OPEN,
    SYMBOL_BLOCKED,
    DAILY_LOSS_PAUSE_ACTIVE,
    MAX_OPEN_POSITIONS,
    INTERNAL_ERROR
}
