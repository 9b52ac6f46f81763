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

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AntiRepetitionGate implements RiskGate {

    private final TradeHistoryRepository tradeHistoryRepository;

    @Override
    public String name() {
        return "antiRepetition";
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        if (tradeHistoryRepository.findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc(
                accountState.accountId(), signal.symbol(), ExitReason.ACTIVE).isPresent()) {
            return RiskDecision.reject(RiskRejectCode.POSITION_ALREADY_OPEN,
                    "Position already open on " + signal.symbol());
        }
        int windowMinutes = profile.antiRepetitionWindowMinutes();
        if (windowMinutes <= 0) {
            return RiskDecision.allow();
        }
        Instant since = accountState.evaluatedAt().minus(Duration.ofMinutes(windowMinutes));
        boolean recent = tradeHistoryRepository.existsByAccountIdAndStrategyIdAndSymbolAndDirectionAndEntryTimeGreaterThanEqual(
                accountState.accountId(), accountState.strategyId(), signal.symbol(), signal.direction(), since);
        if (recent) {
            return RiskDecision.reject(RiskRejectCode.RECENT_DUPLICATE,
                    "Same " + signal.direction() + " trade on " + signal.symbol() + " within " + windowMinutes + " minutes",
                    Map.of("windowMinutes", windowMinutes));
        }
        return RiskDecision.allow();
    }
}
