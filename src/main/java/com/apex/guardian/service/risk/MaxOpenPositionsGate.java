package com.apex.guardian.service.risk;

import com.apex.guardian.model.ExitReason;
import com.apex.guardian.repository.TradeHistoryRepository;
import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskGate;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.apex.guardian.trading.pipeline.TradeSignal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Caps the number of trades an account holds at once, across all of its strategies.
 */
@Component
@RequiredArgsConstructor
public class MaxOpenPositionsGate implements RiskGate {

    private final TradeHistoryRepository tradeHistoryRepository;

    @Override
    public String name() {
        return "maxOpenPositions";
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        if (profile.unlimitedOpenPositions()) {
            return RiskDecision.allow();
        }
        long open = tradeHistoryRepository.countByAccountIdAndExitReason(accountState.accountId(), ExitReason.ACTIVE);
        if (open >= profile.maxOpenPositions()) {
            return RiskDecision.reject(RiskRejectCode.MAX_OPEN_POSITIONS,
                    open + " open trade(s), limit is " + profile.maxOpenPositions(),
                    Map.of("open", open, "limit", profile.maxOpenPositions()));
        }
        return RiskDecision.allow();
    }
}
