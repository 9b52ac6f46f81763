package com.apex.guardian.service.exchange;

import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.model.Direction;
import com.apex.guardian.service.marketdata.ExchangeFilters;
import com.apex.guardian.service.marketdata.Kline;
import com.apex.guardian.service.marketdata.LeverageBracket;
import com.apex.guardian.service.marketdata.OrderBookSnapshot;
import com.apex.guardian.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated exchange. Market orders fill at the current mark price; protective orders fire
 * when {@link #setMarkPrice(String, BigDecimal)} crosses their trigger.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "execution.paper.enabled", havingValue = "true", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private static final String STOP_MARKET = "STOP_MARKET";
    private static final String TAKE_PROFIT_MARKET = "TAKE_PROFIT_MARKET";

    private final ExecutionProperties.Paper config;
    private final AtomicLong orderSequence = new AtomicLong();
    private final Map<String, BigDecimal> markPrices = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> balances = new ConcurrentHashMap<>();
    private final Map<String, ExchangePosition> positions = new ConcurrentHashMap<>();
    private final Map<String, List<OpenOrder>> orders = new ConcurrentHashMap<>();
    // Orders no longer open, by order id
    private final Map<String, OrderAck> doneOrders = new ConcurrentHashMap<>();
    private final Map<String, Integer> leverage = new ConcurrentHashMap<>();

    public PaperExchangeGateway(ExecutionProperties executionProperties) {
        this.config = executionProperties.getPaper();
        config.getMarkPrices().forEach((symbol, price) ->
                markPrices.put(symbol.toUpperCase(Locale.ROOT), BigDecimal.valueOf(price)));
    }

    @Override
    public BigDecimal getBalance(String accountId) {
        return balances.computeIfAbsent(accountId, id -> MoneyUtils.bd(config.getInitialBalance()));
    }

    @Override
    public BigDecimal getMarkPrice(String symbol) {
        BigDecimal price = markPrices.get(symbol.toUpperCase(Locale.ROOT));
        if (price == null) {
            throw new ExchangeApiException("Unknown symbol " + symbol, -1121, null);
        }
        return price;
    }

    @Override
    public OrderBookSnapshot getOrderBook(String symbol, int depth) {
        BigDecimal mark = getMarkPrice(symbol);
        BigDecimal tick = BigDecimal.valueOf(config.getTickSize());
        List<OrderBookSnapshot.Level> bids = new ArrayList<>();
        List<OrderBookSnapshot.Level> asks = new ArrayList<>();
        for (int i = 1; i <= depth; i++) {
            BigDecimal offset = tick.multiply(BigDecimal.valueOf(i));
            bids.add(new OrderBookSnapshot.Level(mark.subtract(offset), BigDecimal.ONE));
            asks.add(new OrderBookSnapshot.Level(mark.add(offset), BigDecimal.ONE));
        }
        return new OrderBookSnapshot(symbol, bids, asks);
    }

    @Override
    public List<Kline> getKlines(String symbol, String interval, int limit) {
        BigDecimal mark = getMarkPrice(symbol);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MINUTES);
        List<Kline> klines = new ArrayList<>();
        for (int i = limit - 1; i >= 0; i--) {
            klines.add(new Kline(now.minus(i, ChronoUnit.MINUTES), mark, mark, mark, mark, BigDecimal.ZERO));
        }
        return klines;
    }

    @Override
    public ExchangeFilters getExchangeFilters(String symbol) {
        getMarkPrice(symbol);
        return new ExchangeFilters(symbol,
                BigDecimal.valueOf(config.getTickSize()),
                BigDecimal.valueOf(config.getStepSize()),
                BigDecimal.valueOf(config.getMinQty()));
    }

    @Override
    public LeverageBracket getLeverageBracket(String symbol) {
        getMarkPrice(symbol);
        return new LeverageBracket(symbol, config.getMaxLeverage());
    }

    @Override
    public int setLeverage(String accountId, String symbol, int requested) {
        int applied = Math.max(1, Math.min(requested, config.getMaxLeverage()));
        leverage.put(key(accountId, symbol), applied);
        return applied;
    }

    @Override
    public synchronized OrderAck placeMarketOrder(String accountId, String symbol, OrderSide side,
                                                  BigDecimal quantity, boolean reduceOnly) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new ExchangeApiException("Invalid quantity " + quantity, -4003, null);
        }
        BigDecimal price = getMarkPrice(symbol);
        String positionKey = key(accountId, symbol);
        ExchangePosition current = positions.get(positionKey);
        Direction sideDirection = side == OrderSide.BUY ? Direction.LONG : Direction.SHORT;

        if (reduceOnly) {
            if (current == null || current.isFlat() || current.direction() == sideDirection) {
                throw new ExchangeApiException("ReduceOnly order rejected for " + symbol, -2022, null);
            }
            BigDecimal filled = quantity.min(current.quantity());
            realize(accountId, current, price, filled);
            BigDecimal remaining = current.quantity().subtract(filled);
            if (remaining.signum() == 0) {
                positions.remove(positionKey);
                retireAll(orders.remove(positionKey));
            } else {
                positions.put(positionKey, new ExchangePosition(symbol, current.direction(), remaining, current.entryPrice()));
            }
            return new OrderAck(nextOrderId(), "FILLED", price, filled);
        }

        if (current != null && !current.isFlat() && current.direction() != sideDirection) {
            throw new ExchangeApiException("Opposite position open for " + symbol, -2019, null);
        }
        if (current == null || current.isFlat()) {
            positions.put(positionKey, new ExchangePosition(symbol, sideDirection, quantity, price));
        } else {
            BigDecimal total = current.quantity().add(quantity);
            BigDecimal avg = current.entryPrice().multiply(current.quantity()).add(price.multiply(quantity))
                    .divide(total, price.scale() + 4, RoundingMode.HALF_UP);
            positions.put(positionKey, new ExchangePosition(symbol, sideDirection, total, avg));
        }
        return new OrderAck(nextOrderId(), "FILLED", price, quantity);
    }

    @Override
    public synchronized OrderAck placeStopMarket(String accountId, String symbol, OrderSide side, BigDecimal stopPrice) {
        return placeTrigger(accountId, symbol, side, stopPrice, STOP_MARKET);
    }

    @Override
    public synchronized OrderAck placeTakeProfitMarket(String accountId, String symbol, OrderSide side, BigDecimal stopPrice) {
        return placeTrigger(accountId, symbol, side, stopPrice, TAKE_PROFIT_MARKET);
    }

    @Override
    public synchronized void cancelOrder(String accountId, String symbol, String orderId) {
        List<OpenOrder> open = orders.get(key(accountId, symbol));
        if (open == null || !open.removeIf(order -> order.orderId().equals(orderId))) {
            throw new ExchangeApiException("Unknown order " + orderId, -2011, null);
        }
        doneOrders.put(orderId, new OrderAck(orderId, "CANCELED", null, BigDecimal.ZERO));
    }

    @Override
    public synchronized List<OpenOrder> openOrders(String accountId, String symbol) {
        return List.copyOf(orders.getOrDefault(key(accountId, symbol), List.of()));
    }

    @Override
    public synchronized Optional<OrderAck> getOrder(String accountId, String symbol, String orderId) {
        boolean open = orders.getOrDefault(key(accountId, symbol), List.of()).stream()
                .anyMatch(order -> order.orderId().equals(orderId));
        if (open) {
            return Optional.of(new OrderAck(orderId, "NEW", null, BigDecimal.ZERO));
        }
        return Optional.ofNullable(doneOrders.get(orderId));
    }

    @Override
    public Optional<ExchangePosition> getPosition(String accountId, String symbol) {
        return Optional.ofNullable(positions.get(key(accountId, symbol)));
    }

    /**
     * Moves the simulated mark price and fires any protective order it crosses.
     */
    public synchronized void setMarkPrice(String symbol, BigDecimal price) {
        String normalized = symbol.toUpperCase(Locale.ROOT);
        markPrices.put(normalized, price);
        for (Map.Entry<String, List<OpenOrder>> entry : orders.entrySet()) {
            Iterator<OpenOrder> it = entry.getValue().iterator();
            while (it.hasNext()) {
                OpenOrder order = it.next();
                if (!order.symbol().equalsIgnoreCase(normalized) || !isTriggered(order, price)) {
                    continue;
                }
                ExchangePosition position = positions.remove(entry.getKey());
                String accountId = entry.getKey().substring(0, entry.getKey().lastIndexOf(':'));
                if (position != null) {
                    realize(accountId, position, price, position.quantity());
                    log.info("Paper {} {} triggered for account={} symbol={} at {}",
                            order.type(), order.orderId(), accountId, normalized, price);
                }
                doneOrders.put(order.orderId(), new OrderAck(order.orderId(), "FILLED", price,
                        position != null ? position.quantity() : BigDecimal.ZERO));
                it.remove();
                retireAll(entry.getValue());
                entry.getValue().clear();
                break;
            }
        }
    }

    private OrderAck placeTrigger(String accountId, String symbol, OrderSide side, BigDecimal stopPrice, String type) {
        if (stopPrice == null || stopPrice.signum() <= 0) {
            throw new ExchangeApiException("Invalid stop price " + stopPrice, -1102, null);
        }
        BigDecimal mark = getMarkPrice(symbol);
        OpenOrder order = new OpenOrder(nextOrderId(), symbol, type, side, stopPrice);
        if (isTriggered(order, mark)) {
            throw new ExchangeApiException("Order would immediately trigger", -2021, null);
        }
        orders.computeIfAbsent(key(accountId, symbol), k -> new ArrayList<>()).add(order);
        return new OrderAck(order.orderId(), "NEW", null, BigDecimal.ZERO);
    }

    private void retireAll(List<OpenOrder> retired) {
        if (retired == null) {
            return;
        }
        retired.forEach(order -> doneOrders.put(order.orderId(),
                new OrderAck(order.orderId(), "EXPIRED", null, BigDecimal.ZERO)));
    }

    private boolean isTriggered(OpenOrder order, BigDecimal mark) {
        boolean sellSide = order.side() == OrderSide.SELL;
        if (STOP_MARKET.equals(order.type())) {
            return sellSide ? mark.compareTo(order.stopPrice()) <= 0 : mark.compareTo(order.stopPrice()) >= 0;
        }
        return sellSide ? mark.compareTo(order.stopPrice()) >= 0 : mark.compareTo(order.stopPrice()) <= 0;
    }

    private void realize(String accountId, ExchangePosition position, BigDecimal exitPrice, BigDecimal quantity) {
        BigDecimal pnl = MoneyUtils.pnl(position.direction().isLong(), position.entryPrice(), exitPrice, quantity);
        balances.merge(accountId, MoneyUtils.add(MoneyUtils.bd(config.getInitialBalance()), pnl),
                (existing, ignored) -> MoneyUtils.add(existing, pnl));
    }

    private String nextOrderId() {
        return "PAPER-" + orderSequence.incrementAndGet();
    }

    private static String key(String accountId, String symbol) {
        return accountId + ":" + symbol.toUpperCase(Locale.ROOT);
    }
}
