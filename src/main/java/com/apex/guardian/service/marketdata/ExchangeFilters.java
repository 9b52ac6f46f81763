package com.apex.guardian.service.marketdata;

import java.math.BigDecimal;

/**
 * PRICE_FILTER tick size and LOT_SIZE step of one symbol.
 */
public record ExchangeFilters(String symbol, BigDecimal tickSize, BigDecimal stepSize, BigDecimal minQty) {}
