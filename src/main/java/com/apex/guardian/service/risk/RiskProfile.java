package com.apex.guardian.service.risk;

import java.util.Locale;
import java.util.Set;

/**
 * Parsed, validated and immutable risk configuration of one (account, strategy) pair.
 * A new version of the stored row produces a new instance; instances are never mutated.
 */
public record RiskProfile(
        String accountId,
        String strategyId,
        long version,
        boolean enabled,
        boolean tierFilterEnabled,
        int tierCeiling,
        boolean scheduleEnabled,
        TradingSchedule schedule,
        CircuitBreakerRule circuitBreaker,
        int antiRepetitionWindowMinutes,
        Set<String> blacklistedSymbols,
        DailyLossRule dailyLoss,
        int maxOpenPositions,
        double riskPct,
        int maxLeverage,
        boolean guardianEnabled,
        boolean halfCloseEnabled
) {

    public RiskProfile {
        if (tierCeiling < 1 || tierCeiling > 10) {
            throw new IllegalArgumentException("tier ceiling must be within 1..10, was " + tierCeiling);
        }
        blacklistedSymbols = blacklistedSymbols == null ? Set.of() : Set.copyOf(blacklistedSymbols);
        maxOpenPositions = Math.max(0, maxOpenPositions);
    }

    /**
     * @return true when the account may hold any number of simultaneous positions
     */
    public boolean unlimitedOpenPositions() {
        return maxOpenPositions == 0;
    }

    public boolean isBlacklisted(String symbol) {
        return symbol != null && blacklistedSymbols.contains(symbol.trim().toUpperCase(Locale.ROOT));
    }

    public record CircuitBreakerRule(boolean enabled, int maxLosses, int windowMinutes, int cooldownMinutes) {}

    public record DailyLossRule(boolean enabled, double maxLossPct, int pauseDurationHours) {}
}
