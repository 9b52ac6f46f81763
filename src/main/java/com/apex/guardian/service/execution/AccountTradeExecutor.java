package com.apex.guardian.service.execution;

import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.exception.MarketDataUnavailableException;
import com.apex.guardian.exception.RiskProfileNotFoundException;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.service.AlertService;
import com.apex.guardian.service.TradeHistoryService;
import com.apex.guardian.service.exchange.ExchangeCallExecutor;
import com.apex.guardian.service.exchange.ExchangeGateway;
import com.apex.guardian.service.exchange.ExchangeGateway.OrderAck;
import com.apex.guardian.service.exchange.OrderSide;
import com.apex.guardian.service.guardian.GuardianPosition;
import com.apex.guardian.service.guardian.PositionGuardianService;
import com.apex.guardian.service.risk.RiskProfile;
import com.apex.guardian.service.risk.RiskProfileService;
import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskProtectionPipeline;
import com.apex.guardian.trading.pipeline.TradeSignal;
import com.apex.guardian.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Runs one signal for one account, strictly in order: profile, risk pipeline, sizing, leverage,
 * entry, protective orders, history row and guardian position.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountTradeExecutor {

    public static final String ACCOUNT_ID_KEY = "accountId";

    private final RiskProfileService riskProfileService;
    private final RiskProtectionPipeline riskProtectionPipeline;
    private final PositionSizingService positionSizingService;
    private final ProtectiveOrderService protectiveOrderService;
    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final TradeHistoryService tradeHistoryService;
    private final PositionGuardianService positionGuardianService;
    private final AlertService alertService;

    public AccountOutcome execute(TradeSignal signal, String accountId, String strategyId, DispatchTicket ticket) {
        MDC.put(ACCOUNT_ID_KEY, accountId);
        try {
            if (ticket.isCancelled()) {
                return AccountOutcome.failed(accountId, ExecutionCoordinator.COORDINATOR_TIMEOUT);
            }
            return executeInternal(signal, accountId, strategyId, ticket);
        } catch (RiskProfileNotFoundException e) {
            return AccountOutcome.rejected(accountId, "PROFILE_NOT_FOUND");
        } catch (MarketDataUnavailableException e) {
            log.warn("Market data unavailable for account={} symbol={}: {}", accountId, signal.symbol(), e.getMessage());
            return AccountOutcome.failed(accountId, "MARKET_DATA_UNAVAILABLE");
        } catch (ExchangeApiException e) {
            log.warn("Exchange error for account={} symbol={}: {}", accountId, signal.symbol(), e.getMessage());
            return AccountOutcome.failed(accountId, "EXCHANGE_ERROR: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing {} for account={}", signal.symbol(), accountId, e);
            return AccountOutcome.failed(accountId, "INTERNAL_ERROR");
        } finally {
            MDC.remove(ACCOUNT_ID_KEY);
        }
    }

    private AccountOutcome executeInternal(TradeSignal signal, String accountId, String strategyId,
                                           DispatchTicket ticket) {
        RiskProfile profile = riskProfileService.load(accountId, strategyId);
        if (!profile.enabled()) {
            return AccountOutcome.rejected(accountId, "ACCOUNT_DISABLED");
        }
        settleClosedTrade(accountId, signal.symbol());
        RiskDecision decision = riskProtectionPipeline.evaluate(signal, profile,
                new AccountState(accountId, strategyId, Instant.now()));
        if (!decision.allowed()) {
            return AccountOutcome.rejected(accountId, decision.code().name());
        }

        BigDecimal balance = exchangeCallExecutor.call("balance", () -> exchangeGateway.getBalance(accountId));
        PositionSizingService.Sizing sizing = positionSizingService.size(signal, profile, balance);
        if (!sizing.isTradable()) {
            return AccountOutcome.failed(accountId, "INVALID_QUANTITY");
        }
        exchangeCallExecutor.call("setLeverage",
                () -> exchangeGateway.setLeverage(accountId, signal.symbol(), sizing.leverage()));

        if (!ticket.beginEntry()) {
            log.warn("Coordinator deadline passed before entry for account={} symbol={}; not entering", accountId,
                    signal.symbol());
            return AccountOutcome.failed(accountId, ExecutionCoordinator.COORDINATOR_TIMEOUT);
        }
        OrderAck entry = exchangeCallExecutor.call("entry", () -> exchangeGateway.placeMarketOrder(accountId,
                signal.symbol(), OrderSide.opening(signal.direction()), sizing.quantity(), false));
        ticket.entryPlaced(entry.orderId());
        BigDecimal entryPrice = entry.avgPrice() != null ? entry.avgPrice() : signal.entryPrice();
        BigDecimal filledQty = entry.executedQty() != null && entry.executedQty().signum() > 0
                ? entry.executedQty() : sizing.quantity();
        log.info("Entry filled account={} symbol={} {} qty={} at {} order={}", accountId, signal.symbol(),
                signal.direction(), filledQty, entryPrice, entry.orderId());

        ProtectiveOrderService.Protection protection = protectiveOrderService.protect(accountId, signal.symbol(),
                signal.direction(), signal.stopPrice(), signal.targetPrice());

        Long tradeId = recordHistory(signal, accountId, strategyId, entry.orderId(), entryPrice, filledQty, protection);
        registerPosition(GuardianPosition.builder()
                .accountId(accountId)
                .strategyId(strategyId)
                .symbol(signal.symbol())
                .direction(signal.direction())
                .entryPrice(entryPrice)
                .quantity(filledQty)
                .currentStop(protection.slOrderId() != null ? signal.stopPrice() : null)
                .currentTarget(protection.tpOrderId() != null ? signal.targetPrice() : null)
                .orderId(entry.orderId())
                .slOrderId(protection.slOrderId())
                .tpOrderId(protection.tpOrderId())
                .lastAdjustmentTs(System.currentTimeMillis())
                .tradeId(tradeId)
                .realizedPnl(MoneyUtils.ZERO)
                .build());

        if (!protection.isComplete()) {
            return AccountOutcome.unprotected(accountId, protection.failure(), entry.orderId());
        }
        return AccountOutcome.executed(accountId, entry.orderId());
    }

    // A stop or target that fired since the last signal still has an open history row
    private void settleClosedTrade(String accountId, String symbol) {
        try {
            positionGuardianService.settleIfFlat(accountId, symbol).ifPresent(reason ->
                    log.info("Settled earlier trade account={} symbol={} as {}", accountId, symbol, reason));
        } catch (RuntimeException e) {
            log.warn("Could not settle earlier trade for account={} symbol={}: {}", accountId, symbol, e.getMessage());
        }
    }

    private Long recordHistory(TradeSignal signal, String accountId, String strategyId, String orderId,
                               BigDecimal entryPrice, BigDecimal quantity, ProtectiveOrderService.Protection protection) {
        try {
            TradeHistory saved = tradeHistoryService.recordEntry(TradeHistory.builder()
                    .accountId(accountId)
                    .strategyId(strategyId)
                    .symbol(signal.symbol())
                    .direction(signal.direction())
                    .entryTime(Instant.now())
                    .entryPrice(entryPrice)
                    .stopPrice(signal.stopPrice())
                    .targetPrice(signal.targetPrice())
                    .quantity(quantity)
                    .orderId(orderId)
                    .slOrderId(protection.slOrderId())
                    .tpOrderId(protection.tpOrderId())
                    .probability(signal.probability())
                    .signalQualityScore(signal.signalQualityScore())
                    .riskReward(signal.riskReward())
                    .build());
            return saved.getId();
        } catch (RuntimeException e) {
            log.error("Trade history write failed for account={} symbol={}", accountId, signal.symbol(), e);
            alertService.sendAlert(AlertService.Severity.CRITICAL, "HISTORY_WRITE_FAILED", accountId, signal.symbol(),
                    "Entry " + orderId + " filled but trade history row not written: " + e.getMessage());
            return null;
        }
    }

    private void registerPosition(GuardianPosition position) {
        try {
            positionGuardianService.register(position);
        } catch (RuntimeException e) {
            log.error("Position record write failed for account={} symbol={}", position.getAccountId(),
                    position.getSymbol(), e);
            alertService.sendAlert(AlertService.Severity.CRITICAL, "DEGRADED_STATE", position.getAccountId(),
                    position.getSymbol(), "Entry " + position.getOrderId() + " filled but position record not written");
        }
    }
}
