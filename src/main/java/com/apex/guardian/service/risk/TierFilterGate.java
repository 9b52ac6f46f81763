package com.apex.guardian.service.risk;

import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskGate;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.apex.guardian.trading.pipeline.TradeSignal;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class TierFilterGate implements RiskGate {

    @Override
    public String name() {
        return "tier";
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        if (!profile.tierFilterEnabled() || signal.tier() == null) {
            return RiskDecision.allow();
        }
        if (signal.tier() > profile.tierCeiling()) {
            return RiskDecision.reject(RiskRejectCode.TIER_REJECTED,
                    "Tier " + signal.tier() + " above ceiling " + profile.tierCeiling(),
                    Map.of("tier", signal.tier(), "tierCeiling", profile.tierCeiling()));
        }
        return RiskDecision.allow();
    }
}
