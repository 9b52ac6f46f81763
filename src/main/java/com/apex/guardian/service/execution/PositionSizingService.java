package com.apex.guardian.service.execution;

import com.apex.guardian.service.marketdata.ExchangeFilters;
import com.apex.guardian.service.marketdata.LeverageBracket;
import com.apex.guardian.service.marketdata.MarketDataCacheService;
import com.apex.guardian.service.risk.RiskProfile;
import com.apex.guardian.trading.pipeline.TradeSignal;
import com.apex.guardian.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fixed-fractional sizing: the distance from entry to stop risks {@code riskPct} of the balance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSizingService {

    private final MarketDataCacheService marketDataCacheService;

    public record Sizing(BigDecimal quantity, int leverage, BigDecimal riskAmount) {

        public boolean isTradable() {
            return quantity != null && quantity.signum() > 0;
        }
    }

    public Sizing size(TradeSignal signal, RiskProfile profile, BigDecimal balance) {
        ExchangeFilters filters = marketDataCacheService.exchangeFilters(signal.symbol());
        LeverageBracket bracket = marketDataCacheService.leverageBracket(signal.symbol());
        int leverage = Math.max(1, Math.min(profile.maxLeverage(), bracket.maxLeverage()));

        BigDecimal riskPerUnit = signal.entryPrice().subtract(signal.stopPrice()).abs();
        if (balance == null || balance.signum() <= 0 || riskPerUnit.signum() == 0) {
            log.warn("Cannot size {} for account={}: balance={} riskPerUnit={}", signal.symbol(),
                    profile.accountId(), balance, riskPerUnit);
            return new Sizing(BigDecimal.ZERO, leverage, BigDecimal.ZERO);
        }
        BigDecimal riskAmount = balance.multiply(BigDecimal.valueOf(profile.riskPct()))
                .divide(BigDecimal.valueOf(100), MathContext.DECIMAL64);
        BigDecimal rawQty = riskAmount.divide(riskPerUnit, 12, RoundingMode.DOWN);
        BigDecimal quantity = MoneyUtils.floorToStep(rawQty, filters.stepSize());
        if (filters.minQty() != null && quantity.compareTo(filters.minQty()) < 0) {
            quantity = BigDecimal.ZERO;
        }
        log.info("Sizing account={} symbol={} balance={} risk={}% qty={} leverage={}x", profile.accountId(),
                signal.symbol(), balance, profile.riskPct(), quantity, leverage);
        return new Sizing(quantity, leverage, riskAmount);
    }
}
