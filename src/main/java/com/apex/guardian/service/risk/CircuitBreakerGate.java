package com.apex.guardian.service.risk;

import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskGate;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.apex.guardian.trading.pipeline.TradeSignal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Blocks a strategy after too many losing closes within the trailing window, until the cooldown
 * measured from the latest loss has passed.
 */
@Component
@RequiredArgsConstructor
public class CircuitBreakerGate implements RiskGate {

    private final TradeHistoryRepository tradeHistoryRepository;

    @Override
    public String name() {
        return "circuitBreaker";
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        RiskProfile.CircuitBreakerRule rule = profile.circuitBreaker();
        if (!rule.enabled()) {
            return RiskDecision.allow();
        }
        Instant now = accountState.evaluatedAt();
        Instant since = now.minus(Duration.ofMinutes(rule.windowMinutes()));
        List<TradeHistory> losses = tradeHistoryRepository.findLossesSince(
                accountState.accountId(), accountState.strategyId(), since);
        if (losses.size() < rule.maxLosses()) {
            return RiskDecision.allow();
        }
        Instant latestLoss = losses.get(0).getExitTime();
        Instant releaseAt = latestLoss.plus(Duration.ofMinutes(rule.cooldownMinutes()));
        if (!now.isBefore(releaseAt)) {
            return RiskDecision.allow();
        }
        return RiskDecision.reject(RiskRejectCode.CIRCUIT_BREAKER_ACTIVE,
                losses.size() + " losses in " + rule.windowMinutes() + " minutes",
                Map.of("losses", losses.size(), "maxLosses", rule.maxLosses(), "until", releaseAt.toString()));
    }
}
