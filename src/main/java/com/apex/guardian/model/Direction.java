package com.apex.guardian.model;

import java.util.Locale;

public enum Direction {
    LONG,
    SHORT;

    /**
     * Accepts LONG/SHORT as well as the order-side aliases BUY/SELL.
     */
    public static Direction from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction is required");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "LONG", "BUY" -> LONG;
            case "SHORT", "SELL" -> SHORT;
            default -> throw new IllegalArgumentException("Unknown direction: " + value);
        };
    }

    public boolean isLong() {
        return this == LONG;
    }
}
