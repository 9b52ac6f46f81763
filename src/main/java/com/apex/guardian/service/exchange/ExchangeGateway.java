package com.apex.guardian.service.exchange;

import com.apex.guardian.model.Direction;
import com.apex.guardian.service.marketdata.ExchangeFilters;
import com.apex.guardian.service.marketdata.Kline;
import com.apex.guardian.service.marketdata.LeverageBracket;
import com.apex.guardian.service.marketdata.OrderBookSnapshot;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Boundary to a futures exchange. Account-scoped calls resolve the account's own credentials
 * internally; nothing returned here carries them.
 *
 * Implementations throw {@link com.apex.guardian.exception.ExchangeTransientException} for
 * retryable failures and {@link com.apex.guardian.exception.ExchangeApiException} otherwise.
 */
public interface ExchangeGateway {

    BigDecimal getBalance(String accountId);

    BigDecimal getMarkPrice(String symbol);

    OrderBookSnapshot getOrderBook(String symbol, int depth);

    List<Kline> getKlines(String symbol, String interval, int limit);

    ExchangeFilters getExchangeFilters(String symbol);

    LeverageBracket getLeverageBracket(String symbol);

    int setLeverage(String accountId, String symbol, int leverage);

    OrderAck placeMarketOrder(String accountId, String symbol, OrderSide side, BigDecimal quantity, boolean reduceOnly);

    /**
     * Stop-market order that closes the whole position when triggered.
     */
    OrderAck placeStopMarket(String accountId, String symbol, OrderSide side, BigDecimal stopPrice);

    /**
     * Take-profit-market order that closes the whole position when triggered.
     */
    OrderAck placeTakeProfitMarket(String accountId, String symbol, OrderSide side, BigDecimal stopPrice);

    void cancelOrder(String accountId, String symbol, String orderId);

    List<OpenOrder> openOrders(String accountId, String symbol);

    /**
     * State of an order placed earlier, including orders that have since filled or been cancelled.
     * Status is one of NEW, PARTIALLY_FILLED, FILLED, CANCELED or EXPIRED.
     */
    Optional<OrderAck> getOrder(String accountId, String symbol, String orderId);

    Optional<ExchangePosition> getPosition(String accountId, String symbol);

    record OrderAck(String orderId, String status, BigDecimal avgPrice, BigDecimal executedQty) {

        public boolean isFilled() {
            return "FILLED".equals(status);
        }

        public boolean isWorking() {
            return "NEW".equals(status) || "PARTIALLY_FILLED".equals(status);
        }
    }

    record OpenOrder(String orderId, String symbol, String type, OrderSide side, BigDecimal stopPrice) {}

    record ExchangePosition(String symbol, Direction direction, BigDecimal quantity, BigDecimal entryPrice) {

        public boolean isFlat() {
            return quantity == null || quantity.signum() == 0;
        }
    }
}
