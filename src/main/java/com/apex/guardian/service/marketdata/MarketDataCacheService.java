package com.apex.guardian.service.marketdata;

import com.apex.guardian.config.MarketDataProperties;
import com.apex.guardian.core.FastStateStore;
import com.apex.guardian.exception.MarketDataUnavailableException;
import com.apex.guardian.service.MetricsService;
import com.apex.guardian.service.exchange.ExchangeCallExecutor;
import com.apex.guardian.service.exchange.ExchangeGateway;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-through cache for market facts. A fact older than its kind's TTL is never returned;
 * a failed live refresh surfaces as {@link MarketDataUnavailableException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataCacheService {

    private final FastStateStore fastStateStore;
    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final MarketDataProperties marketDataProperties;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public BigDecimal markPrice(String symbol) {
        return this.<BigDecimal>get(FactKind.MARK_PRICE, symbol).value();
    }

    public ExchangeFilters exchangeFilters(String symbol) {
        return this.<ExchangeFilters>get(FactKind.EXCHANGE_FILTERS, symbol).value();
    }

    public LeverageBracket leverageBracket(String symbol) {
        return this.<LeverageBracket>get(FactKind.LEVERAGE_BRACKETS, symbol).value();
    }

    public OrderBookSnapshot orderBook(String symbol) {
        return this.<OrderBookSnapshot>get(FactKind.ORDER_BOOK, symbol).value();
    }

    public List<Kline> klines(String symbol) {
        return this.<List<Kline>>get(FactKind.KLINES, symbol).value();
    }

    public <T> CachedFact<T> get(FactKind kind, String symbol) {
        String key = cacheKey(kind, symbol);
        Duration ttl = kind.ttl(marketDataProperties.getTtl());
        Instant now = Instant.now();

        Optional<CachedFact<T>> cached = readCached(kind, key);
        if (cached.isPresent() && cached.get().isFresh(now, ttl)) {
            metricsService.recordCacheLookup(kind.name(), "hit");
            return new CachedFact<>(cached.get().value(), cached.get().capturedAt(), FactSource.CACHE);
        }
        metricsService.recordCacheLookup(kind.name(), "miss");

        T live = fetchLive(kind, symbol);
        Instant capturedAt = Instant.now();
        writeBack(key, live, capturedAt, ttl);
        return new CachedFact<>(live, capturedAt, FactSource.LIVE);
    }

    static String cacheKey(FactKind kind, String symbol) {
        return "md:" + kind.name() + ":" + symbol.toUpperCase(Locale.ROOT);
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<CachedFact<T>> readCached(FactKind kind, String key) {
        try {
            Optional<String> raw = fastStateStore.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(raw.get());
            T value = (T) objectMapper.convertValue(node.get("value"), kind.valueType());
            Instant capturedAt = Instant.ofEpochMilli(node.get("capturedAt").asLong());
            return Optional.of(new CachedFact<>(value, capturedAt, FactSource.CACHE));
        } catch (Exception e) {
            metricsService.recordCacheLookup(kind.name(), "error");
            log.warn("Market cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeBack(String key, Object value, Instant capturedAt, Duration ttl) {
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.set("value", objectMapper.valueToTree(value));
            node.put("capturedAt", capturedAt.toEpochMilli());
            fastStateStore.put(key, objectMapper.writeValueAsString(node), ttl);
        } catch (Exception e) {
            log.warn("Market cache write failed for {}: {}", key, e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T fetchLive(FactKind kind, String symbol) {
        try {
            Object value = switch (kind) {
                case MARK_PRICE -> exchangeCallExecutor.call("markPrice",
                        () -> exchangeGateway.getMarkPrice(symbol));
                case ORDER_BOOK -> exchangeCallExecutor.call("orderBook",
                        () -> exchangeGateway.getOrderBook(symbol, marketDataProperties.getOrderBookDepth()));
                case KLINES -> exchangeCallExecutor.call("klines",
                        () -> exchangeGateway.getKlines(symbol, marketDataProperties.getKlinesInterval(),
                                marketDataProperties.getKlinesLimit()));
                case EXCHANGE_FILTERS -> exchangeCallExecutor.call("exchangeFilters",
                        () -> exchangeGateway.getExchangeFilters(symbol));
                case LEVERAGE_BRACKETS -> exchangeCallExecutor.call("leverageBracket",
                        () -> exchangeGateway.getLeverageBracket(symbol));
            };
            if (value == null) {
                throw new IllegalStateException("exchange returned no " + kind + " for " + symbol);
            }
            return (T) value;
        } catch (RuntimeException e) {
            metricsService.recordCacheLookup(kind.name(), "unavailable");
            throw new MarketDataUnavailableException(kind + " unavailable for " + symbol + ": " + e.getMessage(), e);
        }
    }
}
