package com.apex.guardian.service.marketdata;

import com.apex.guardian.config.MarketDataProperties;
import com.fasterxml.jackson.core.type.TypeReference;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Market facts served through the cache, each with its own freshness budget.
 */
public enum FactKind {
    MARK_PRICE(new TypeReference<BigDecimal>() {}),
    ORDER_BOOK(new TypeReference<OrderBookSnapshot>() {}),
    KLINES(new TypeReference<List<Kline>>() {}),
    EXCHANGE_FILTERS(new TypeReference<ExchangeFilters>() {}),
    LEVERAGE_BRACKETS(new TypeReference<LeverageBracket>() {});

    private final TypeReference<?> valueType;

    FactKind(TypeReference<?> valueType) {
        this.valueType = valueType;
    }

    public TypeReference<?> valueType() {
        return valueType;
    }

    public Duration ttl(MarketDataProperties.Ttl ttl) {
        return switch (this) {
            case MARK_PRICE -> Duration.ofSeconds(ttl.getMarkPriceSeconds());
            case ORDER_BOOK -> Duration.ofSeconds(ttl.getOrderBookSeconds());
            case KLINES -> Duration.ofSeconds(ttl.getKlinesSeconds());
            case EXCHANGE_FILTERS -> Duration.ofSeconds(ttl.getExchangeFiltersSeconds());
            case LEVERAGE_BRACKETS -> Duration.ofSeconds(ttl.getLeverageBracketsSeconds());
        };
    }
}
