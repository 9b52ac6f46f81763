package com.apex.guardian.service.marketdata;

import java.math.BigDecimal;
import java.util.List;

public record OrderBookSnapshot(String symbol, List<Level> bids, List<Level> asks) {

    public record Level(BigDecimal price, BigDecimal quantity) {}
}
