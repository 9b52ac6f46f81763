package com.apex.guardian.service.risk;

import com.apex.guardian.repository.TradeHistoryRepository;
import com.apex.guardian.service.exchange.ExchangeCallExecutor;
import com.apex.guardian.service.exchange.ExchangeGateway;
import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskGate;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.apex.guardian.trading.pipeline.TradeSignal;
import com.apex.guardian.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

/**
 * Pauses a strategy once the day's realized loss reaches the limit, measured against the balance
 * the account started the UTC day with (current balance minus today's realized PnL).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyLossGate implements RiskGate {

    private final TradeHistoryRepository tradeHistoryRepository;
    private final TradePauseService tradePauseService;
    private final DailyBalanceCache dailyBalanceCache;
    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;

    @Override
    public String name() {
        return "dailyLoss";
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        RiskProfile.DailyLossRule rule = profile.dailyLoss();
        if (!rule.enabled()) {
            return RiskDecision.allow();
        }
        String accountId = accountState.accountId();
        String strategyId = accountState.strategyId();
        Instant now = accountState.evaluatedAt();

        Optional<TradePauseService.TradePause> pause = tradePauseService.activePause(accountId, strategyId, now);
        if (pause.isPresent()) {
            return RiskDecision.reject(RiskRejectCode.DAILY_LOSS_PAUSE_ACTIVE,
                    "Trading paused until " + pause.get().resumeAt(),
                    Map.of("resumeAt", pause.get().resumeAt().toString()));
        }

        Instant startOfDay = now.atZone(ZoneOffset.UTC).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        BigDecimal dailyPnl = MoneyUtils.scale(tradeHistoryRepository.sumPnlSince(accountId, strategyId, startOfDay));
        BigDecimal initialBalance = dailyBalanceCache.initialBalance(accountId, strategyId, now, () -> {
            BigDecimal current = exchangeCallExecutor.call("balance", () -> exchangeGateway.getBalance(accountId));
            return MoneyUtils.subtract(current, dailyPnl);
        });
        if (initialBalance.signum() <= 0) {
            throw new IllegalStateException("Initial balance today is not positive: " + initialBalance);
        }
        BigDecimal dailyLossPct = MoneyUtils.percent(dailyPnl, initialBalance);
        BigDecimal limit = BigDecimal.valueOf(rule.maxLossPct()).negate();
        log.debug("Daily PnL account={} strategy={} pnl={} initial={} pct={}", accountId, strategyId,
                dailyPnl, initialBalance, dailyLossPct);

        if (dailyLossPct.compareTo(limit) <= 0) {
            TradePauseService.TradePause created = tradePauseService.pause(accountId, strategyId, now,
                    Duration.ofHours(rule.pauseDurationHours()));
            return RiskDecision.reject(RiskRejectCode.DAILY_LOSS_PAUSE_ACTIVE,
                    "Daily loss " + dailyLossPct + "% reached limit " + rule.maxLossPct() + "%",
                    Map.of("dailyLossPct", dailyLossPct, "dailyPnlUsdt", dailyPnl,
                            "initialBalanceToday", initialBalance, "resumeAt", created.resumeAt().toString()));
        }
        return RiskDecision.allow();
    }
}
