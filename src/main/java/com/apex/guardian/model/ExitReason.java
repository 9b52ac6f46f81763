package com.apex.guardian.model;

public enum ExitReason {
    ACTIVE,
    TARGET_HIT,
    STOP_HIT,
    MANUAL_CLOSE,
    MANUAL_WIN,
    MANUAL_LOST,
    MANUAL_BREAKEVEN,
    EXTERNAL_FLAT;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
