package com.apex.guardian.service.execution;

import java.util.List;

/**
 * Aggregated outcome of one signal across every eligible account. An UNPROTECTED entry counts as
 * executed and also as an alert.
 */
public record DispatchResult(
        String symbol,
        String strategyId,
        List<AccountOutcome> outcomes,
        int total,
        int executed,
        int rejected,
        int failed,
        int alerts
) {

    public static DispatchResult of(String symbol, String strategyId, List<AccountOutcome> outcomes) {
        int executed = 0;
        int rejected = 0;
        int failed = 0;
        int alerts = 0;
        for (AccountOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case EXECUTED -> executed++;
                case UNPROTECTED -> {
                    executed++;
                    alerts++;
                }
                case REJECTED -> rejected++;
                case FAILED -> failed++;
            }
        }
        return new DispatchResult(symbol, strategyId, List.copyOf(outcomes), outcomes.size(),
                executed, rejected, failed, alerts);
    }

    public boolean anyExecuted() {
        return executed > 0;
    }
}
