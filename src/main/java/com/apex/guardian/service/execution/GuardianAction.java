package com.apex.guardian.service.execution;

import java.util.Locale;

public enum GuardianAction {
    CLOSE,
    ADJUST,
    ADJUST_TARGET,
    ADJUST_BOTH,
    HALF_CLOSE;

    public static GuardianAction from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown guardian action: " + value, e);
        }
    }
}
