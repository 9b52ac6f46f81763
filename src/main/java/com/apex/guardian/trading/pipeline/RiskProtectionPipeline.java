package com.apex.guardian.trading.pipeline;

import com.apex.guardian.service.AuditEventService;
import com.apex.guardian.service.MetricsService;
import com.apex.guardian.service.risk.AntiRepetitionGate;
import com.apex.guardian.service.risk.CircuitBreakerGate;
import com.apex.guardian.service.risk.DailyLossGate;
import com.apex.guardian.service.risk.MaxOpenPositionsGate;
import com.apex.guardian.service.risk.RiskProfile;
import com.apex.guardian.service.risk.ScheduleGate;
import com.apex.guardian.service.risk.SymbolBlacklistGate;
import com.apex.guardian.service.risk.TierFilterGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a signal for one account against the gates in a fixed order, cheapest and most certain
 * first. The first rejection wins. A gate that throws rejects with {@link RiskRejectCode#INTERNAL_ERROR}
 * unless it is declared fail-open.
 */
@Slf4j
@Service
public class RiskProtectionPipeline {

    private final List<RiskGate> gates;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;

    @Autowired
    public RiskProtectionPipeline(TierFilterGate tierFilterGate,
                                  ScheduleGate scheduleGate,
                                  CircuitBreakerGate circuitBreakerGate,
                                  AntiRepetitionGate antiRepetitionGate,
                                  SymbolBlacklistGate symbolBlacklistGate,
                                  DailyLossGate dailyLossGate,
                                  MaxOpenPositionsGate maxOpenPositionsGate,
                                  AuditEventService auditEventService,
                                  MetricsService metricsService) {
        this(List.of(tierFilterGate, scheduleGate, circuitBreakerGate, antiRepetitionGate, symbolBlacklistGate,
                dailyLossGate, maxOpenPositionsGate), auditEventService, metricsService);
    }

    RiskProtectionPipeline(List<RiskGate> gates, AuditEventService auditEventService, MetricsService metricsService) {
        this.gates = List.copyOf(gates);
        this.auditEventService = auditEventService;
        this.metricsService = metricsService;
    }

    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        RiskDecision decision = RiskDecision.allow();
        String decidedBy = null;
        for (RiskGate gate : gates) {
            RiskDecision gateDecision = runGate(gate, signal, profile, accountState);
            if (!gateDecision.allowed()) {
                decision = gateDecision;
                decidedBy = gate.name();
                break;
            }
        }
        if (decision.allowed()) {
            log.info("Risk pipeline passed account={} strategy={} symbol={}", accountState.accountId(),
                    accountState.strategyId(), signal.symbol());
        } else {
            metricsService.recordRiskRejection(decision.code().name());
            log.info("Risk pipeline rejected account={} strategy={} symbol={} gate={} code={} - {}",
                    accountState.accountId(), accountState.strategyId(), signal.symbol(), decidedBy,
                    decision.code(), decision.message());
        }
        audit(signal, accountState, decision, decidedBy);
        return decision;
    }

    private RiskDecision runGate(RiskGate gate, TradeSignal signal, RiskProfile profile, AccountState accountState) {
        try {
            return gate.evaluate(signal, profile, accountState);
        } catch (RuntimeException e) {
            if (gate.failOpen()) {
                log.error("Gate {} failed for account={} symbol={}; allowing trade", gate.name(),
                        accountState.accountId(), signal.symbol(), e);
                return RiskDecision.allow();
            }
            log.error("Gate {} failed for account={} symbol={}; rejecting trade", gate.name(),
                    accountState.accountId(), signal.symbol(), e);
            return RiskDecision.reject(RiskRejectCode.INTERNAL_ERROR,
                    "Gate " + gate.name() + " failed: " + e.getMessage(),
                    Map.of("gate", gate.name()));
        }
    }

    private void audit(TradeSignal signal, AccountState accountState, RiskDecision decision, String decidedBy) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("strategyId", accountState.strategyId());
        params.put("direction", signal.direction());
        params.put("tier", signal.tier());
        params.put("entry", signal.entryPrice());
        params.put("stop", signal.stopPrice());
        params.put("target", signal.targetPrice());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("allowed", decision.allowed());
        result.put("code", decision.code());
        result.put("gate", decidedBy);
        result.put("details", decision.details());
        auditEventService.record(accountState.accountId(), signal.symbol(), AuditEventService.RISK_EVALUATION,
                params, result, true, decision.allowed() ? null : decision.message());
    }
}
