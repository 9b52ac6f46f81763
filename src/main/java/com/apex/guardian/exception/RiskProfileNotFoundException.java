package com.apex.guardian.exception;

public class RiskProfileNotFoundException extends TradingException {
    public RiskProfileNotFoundException(String accountId, String strategyId) {
        super("No risk profile for account " + accountId + " strategy " + strategyId);
    }
}
