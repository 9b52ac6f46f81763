package com.apex.guardian.service.risk;

import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskGate;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.apex.guardian.trading.pipeline.TradeSignal;
import org.springframework.stereotype.Component;

@Component
public class SymbolBlacklistGate implements RiskGate {

    @Override
    public String name() {
        return "symbolBlacklist";
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        if (profile.isBlacklisted(signal.symbol())) {
            return RiskDecision.reject(RiskRejectCode.SYMBOL_BLOCKED, signal.symbol() + " is blacklisted");
        }
        return RiskDecision.allow();
    }
}
