package com.apex.guardian.service.execution;

import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.service.risk.RiskProfile;
import com.apex.guardian.service.risk.RiskProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the accounts that take part in a strategy's signals.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountDirectory {

    private final ExecutionProperties executionProperties;
    private final RiskProfileService riskProfileService;

    public String resolveStrategy(String strategyId) {
        return strategyId == null || strategyId.isBlank() ? executionProperties.getDefaultStrategy() : strategyId;
    }

    /**
     * Configured accounts of the strategy whose profile exists and is enabled.
     */
    public List<String> eligibleAccounts(String strategyId) {
        List<String> eligible = new ArrayList<>();
        for (String accountId : new LinkedHashSet<>(executionProperties.accountsFor(strategyId))) {
            Optional<RiskProfile> profile = riskProfileService.find(accountId, strategyId);
            if (profile.isEmpty()) {
                log.warn("Account {} configured for strategy {} has no risk profile; skipped", accountId, strategyId);
            } else if (!profile.get().enabled()) {
                log.info("Account {} disabled for strategy {}", accountId, strategyId);
            } else {
                eligible.add(accountId);
            }
        }
        return eligible;
    }

    public List<String> configuredAccounts() {
        LinkedHashSet<String> all = new LinkedHashSet<>();
        executionProperties.getStrategyAccounts().values().forEach(all::addAll);
        return new ArrayList<>(all);
    }
}
