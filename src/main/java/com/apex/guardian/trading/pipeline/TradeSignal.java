package com.apex.guardian.trading.pipeline;

import com.apex.guardian.model.Direction;

import java.math.BigDecimal;

/**
 * An externally produced trading signal. Immutable once received.
 */
public record TradeSignal(
        String symbol,
        Direction direction,
        BigDecimal entryPrice,
        BigDecimal stopPrice,
        BigDecimal targetPrice,
        Double riskReward,
        Double probability,
        Integer tier,
        Double signalQualityScore,
        String strategyId
) {}
