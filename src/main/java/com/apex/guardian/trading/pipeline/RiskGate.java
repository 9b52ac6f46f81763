package com.apex.guardian.trading.pipeline;

import com.apex.guardian.service.risk.RiskProfile;

/**
 * One independent check of the risk pipeline.
 */
public interface RiskGate {

    String name();

    RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState);

    /**
     * Whether an unexpected error inside this gate lets the signal through instead of rejecting it.
     */
    default boolean failOpen() {
        return false;
    }
}
