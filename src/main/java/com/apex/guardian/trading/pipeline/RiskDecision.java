package com.apex.guardian.trading.pipeline;

import java.util.Map;

public record RiskDecision(
        boolean allowed,
        RiskRejectCode code,
        String message,
        Map<String, Object> details
) {
    public static RiskDecision allow() {
        return new RiskDecision(true, null, null, Map.of());
    }

    public static RiskDecision reject(RiskRejectCode code, String message) {
        return reject(code, message, Map.of());
    }

    public static RiskDecision reject(RiskRejectCode code, String message, Map<String, Object> details) {
        return new RiskDecision(false, code, message, details == null ? Map.of() : details);
    }
}
