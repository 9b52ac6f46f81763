package com.apex.guardian.service.guardian;

import com.apex.guardian.config.GuardianProperties;
import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.exception.MarketDataUnavailableException;
import com.apex.guardian.model.Direction;
import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.service.AlertService;
import com.apex.guardian.service.AuditEventService;
import com.apex.guardian.service.MetricsService;
import com.apex.guardian.service.TradeHistoryService;
import com.apex.guardian.service.exchange.ExchangeCallExecutor;
import com.apex.guardian.service.exchange.ExchangeGateway;
import com.apex.guardian.service.exchange.ExchangeGateway.ExchangePosition;
import com.apex.guardian.service.exchange.ExchangeGateway.OrderAck;
import com.apex.guardian.service.exchange.OrderSide;
import com.apex.guardian.service.marketdata.ExchangeFilters;
import com.apex.guardian.service.marketdata.MarketDataCacheService;
import com.apex.guardian.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Applies guardian actions to open positions.
 *
 * <p>Stops only ever tighten. Every mutation validates against the current mark price before the
 * exchange is touched. Once the exchange has accepted a change, the action is reported as done
 * even if the position record cannot be written; that case is flagged as degraded state instead.
 *
 * <p>Actions on the same (account, symbol) are serialized in-process, and record writes are
 * conditional on {@code lastAdjustmentTs} so that writers in other processes cannot be overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionGuardianService {

    public static final String CLOSE = "CLOSE";
    public static final String ADJUST_STOP = "ADJUST_STOP";
    public static final String ADJUST_TARGET = "ADJUST_TARGET";
    public static final String ADJUST_BOTH = "ADJUST_BOTH";
    public static final String HALF_CLOSE = "HALF_CLOSE";
    public static final String SETTLE = "SETTLE";

    private static final String ACCOUNT_ID_KEY = "accountId";
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final PositionStore positionStore;
    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final MarketDataCacheService marketDataCacheService;
    private final TradeHistoryService tradeHistoryService;
    private final AuditEventService auditEventService;
    private final AlertService alertService;
    private final MetricsService metricsService;
    private final GuardianProperties guardianProperties;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public void register(GuardianPosition position) {
        positionStore.create(position);
        log.info("Guarding {} {} for account={} qty={} stop={} target={}", position.getDirection(), position.getSymbol(),
                position.getAccountId(), position.getQuantity(), position.getCurrentStop(), position.getCurrentTarget());
    }

    public Optional<GuardianPosition> find(String accountId, String symbol) {
        return positionStore.find(accountId, symbol);
    }

    public GuardianActionResult close(String accountId, String symbol) {
        return run(CLOSE, accountId, symbol, Map.of(), () -> withPosition(accountId, symbol, this::closeLocked));
    }

    public GuardianActionResult adjustStop(String accountId, String symbol, BigDecimal newStop, LevelMetadata level) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("stop", newStop);
        if (level != null) {
            params.put("level", level.level());
            params.put("levelThresholdPct", level.thresholdPct());
        }
        return run(ADJUST_STOP, accountId, symbol, params,
                () -> withPosition(accountId, symbol, live -> adjustStopLocked(live, newStop, level)));
    }

    public GuardianActionResult adjustTarget(String accountId, String symbol, BigDecimal newTarget) {
        return run(ADJUST_TARGET, accountId, symbol, Map.of("target", newTarget),
                () -> withPosition(accountId, symbol, live -> adjustTargetLocked(live, newTarget)));
    }

    public GuardianActionResult adjustBoth(String accountId, String symbol, BigDecimal newStop, BigDecimal newTarget) {
        return run(ADJUST_BOTH, accountId, symbol, Map.of("stop", newStop, "target", newTarget),
                () -> withPosition(accountId, symbol, live -> adjustBothLocked(live, newStop, newTarget)));
    }

    public GuardianActionResult halfClose(String accountId, String symbol, boolean moveToBreakEven) {
        return run(HALF_CLOSE, accountId, symbol, Map.of("moveToBreakEven", moveToBreakEven),
                () -> withPosition(accountId, symbol, live -> halfCloseLocked(live, moveToBreakEven)));
    }

    /**
     * Settles a trade whose position is already flat on the exchange, typically because its stop
     * or target fired. The open history row is completed with the exit the exchange reports, a
     * protective order left behind is cancelled and the position record is dropped.
     *
     * @return the recorded exit reason, empty when nothing was open or the position is still live
     */
    public Optional<ExitReason> settleIfFlat(String accountId, String symbol) {
        String normalized = symbol.toUpperCase(Locale.ROOT);
        String key = PositionStore.key(accountId, normalized);
        ReentrantLock lock;
        try {
            lock = acquire(key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (lock == null) {
            log.warn("Skipping settlement of account={} symbol={}: another action holds the position", accountId,
                    normalized);
            return Optional.empty();
        }
        Optional<ExitReason> settled = Optional.empty();
        try {
            settled = settleLocked(accountId, normalized);
            return settled;
        } finally {
            release(key, lock, settled.isPresent());
        }
    }

    int trackedLockCount() {
        return locks.size();
    }

    // ---- actions (called with the key lock held) ----

    private Optional<ExitReason> settleLocked(String accountId, String symbol) {
        Optional<GuardianPosition> stored = positionStore.find(accountId, symbol);
        Optional<TradeHistory> openTrade = tradeHistoryService.findOpen(accountId, symbol);
        if (stored.isEmpty() && openTrade.isEmpty()) {
            return Optional.empty();
        }
        Optional<ExchangePosition> onExchange = exchangeCallExecutor.call("position",
                () -> exchangeGateway.getPosition(accountId, symbol));
        if (onExchange.isPresent() && !onExchange.get().isFlat()) {
            return Optional.empty();
        }
        GuardianPosition position = stored
                .map(p -> p.getTradeId() == null && openTrade.isPresent()
                        ? p.toBuilder().tradeId(openTrade.get().getId()).build() : p)
                .orElseGet(() -> fromHistory(openTrade.get()));

        DetectedExit exit = detectExit(position);
        log.info("Settling account={} symbol={} as {} at {}", accountId, symbol, exit.reason(), exit.price());
        completeHistory(position, exit.price(), exit.reason(), position.getQuantity());
        boolean degraded = stored.isPresent() && !deleteWithRetry(position);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("exitReason", exit.reason());
        result.put("exitPrice", exit.price());
        result.put("tradeId", position.getTradeId());
        result.put("degradedState", degraded);
        metricsService.recordGuardianAction(SETTLE, exit.reason().name());
        auditEventService.record(accountId, symbol, SETTLE, Map.of(), result, true, null);
        return Optional.of(exit.reason());
    }


    private GuardianActionResult closeLocked(LivePosition live) {
        GuardianPosition position = live.position();
        BigDecimal quantity = live.exchange().quantity();
        OrderAck fill;
        try {
            fill = exchangeCallExecutor.call("closePosition", () -> exchangeGateway.placeMarketOrder(
                    position.getAccountId(), position.getSymbol(), OrderSide.closing(position.getDirection()),
                    quantity, true));
        } catch (ExchangeApiException e) {
            return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR, "Close failed: " + e.getMessage(), position);
        }
        cancelQuietly(position, position.getSlOrderId());
        cancelQuietly(position, position.getTpOrderId());

        BigDecimal exitPrice = fill.avgPrice() != null ? fill.avgPrice() : markOrNull(position.getSymbol());
        completeHistory(position, exitPrice, ExitReason.MANUAL_CLOSE, quantity);
        boolean degraded = !deleteWithRetry(position);
        return GuardianActionResult.success(GuardianResultCode.CLOSED,
                "Closed " + quantity + " at " + exitPrice, position).withDegradedState(degraded);
    }

    private GuardianActionResult adjustStopLocked(LivePosition live, BigDecimal requestedStop, LevelMetadata level) {
        GuardianPosition position = live.position();
        ExchangeFilters filters = live.filters();
        BigDecimal newStop = MoneyUtils.roundToTick(requestedStop, filters.tickSize());

        if (sameLevel(newStop, position.getCurrentStop())) {
            return GuardianActionResult.success(GuardianResultCode.NO_CHANGE, "Stop already at " + newStop, position);
        }
        if (!tightens(position.getDirection(), position.getCurrentStop(), newStop)) {
            return GuardianActionResult.rejected(GuardianResultCode.LOOSER_STOP_REJECTED,
                    "Stop " + newStop + " would loosen current stop " + position.getCurrentStop(), position);
        }
        BigDecimal mark = marketDataCacheService.markPrice(position.getSymbol());
        if (!stopPlacementValid(position.getDirection(), newStop, mark)) {
            return GuardianActionResult.rejected(GuardianResultCode.INVALID_STOP_PLACEMENT,
                    "Stop " + newStop + " on wrong side of mark " + mark + " for " + position.getDirection(), position);
        }

        String newSlOrderId;
        try {
            newSlOrderId = replaceStopOrder(position, newStop);
        } catch (ExchangeApiException e) {
            return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR, "Stop update failed: " + e.getMessage(), position);
        }

        GuardianPosition updated = withStop(position, newStop, newSlOrderId, level);
        return persist(position, updated, latest -> tightens(latest.getDirection(), latest.getCurrentStop(), newStop)
                        ? withStop(latest, newStop, newSlOrderId, level) : null,
                GuardianResultCode.APPLIED, "Stop moved to " + newStop);
    }

    private GuardianActionResult adjustTargetLocked(LivePosition live, BigDecimal requestedTarget) {
        GuardianPosition position = live.position();
        BigDecimal newTarget = MoneyUtils.roundToTick(requestedTarget, live.filters().tickSize());
        if (sameLevel(newTarget, position.getCurrentTarget())) {
            return GuardianActionResult.success(GuardianResultCode.NO_CHANGE, "Target already at " + newTarget, position);
        }
        BigDecimal mark = marketDataCacheService.markPrice(position.getSymbol());
        if (!targetPlacementValid(position.getDirection(), newTarget, mark)) {
            return GuardianActionResult.rejected(GuardianResultCode.INVALID_TARGET_PLACEMENT,
                    "Target " + newTarget + " on wrong side of mark " + mark + " for " + position.getDirection(), position);
        }
        String newTpOrderId;
        try {
            newTpOrderId = replaceTargetOrder(position, newTarget);
        } catch (ExchangeApiException e) {
            return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR, "Target update failed: " + e.getMessage(), position);
        }
        GuardianPosition updated = withTarget(position, newTarget, newTpOrderId);
        return persist(position, updated, latest -> withTarget(latest, newTarget, newTpOrderId),
                GuardianResultCode.APPLIED, "Target moved to " + newTarget);
    }

    private GuardianActionResult adjustBothLocked(LivePosition live, BigDecimal requestedStop, BigDecimal requestedTarget) {
        GuardianPosition position = live.position();
        BigDecimal tick = live.filters().tickSize();
        BigDecimal newStop = MoneyUtils.roundToTick(requestedStop, tick);
        BigDecimal newTarget = MoneyUtils.roundToTick(requestedTarget, tick);
        boolean stopChanges = !sameLevel(newStop, position.getCurrentStop());
        boolean targetChanges = !sameLevel(newTarget, position.getCurrentTarget());
        if (!stopChanges && !targetChanges) {
            return GuardianActionResult.success(GuardianResultCode.NO_CHANGE, "Stop and target unchanged", position);
        }

        if (stopChanges && !tightens(position.getDirection(), position.getCurrentStop(), newStop)) {
            return GuardianActionResult.rejected(GuardianResultCode.LOOSER_STOP_REJECTED,
                    "Stop " + newStop + " would loosen current stop " + position.getCurrentStop(), position);
        }
        BigDecimal mark = marketDataCacheService.markPrice(position.getSymbol());
        if (!stopPlacementValid(position.getDirection(), newStop, mark)) {
            return GuardianActionResult.rejected(GuardianResultCode.INVALID_STOP_PLACEMENT,
                    "Stop " + newStop + " on wrong side of mark " + mark + " for " + position.getDirection(), position);
        }
        if (!targetPlacementValid(position.getDirection(), newTarget, mark)) {
            return GuardianActionResult.rejected(GuardianResultCode.INVALID_TARGET_PLACEMENT,
                    "Target " + newTarget + " on wrong side of mark " + mark + " for " + position.getDirection(), position);
        }

        GuardianPosition updated = position;
        if (stopChanges) {
            try {
                updated = withStop(updated, newStop, replaceStopOrder(position, newStop), null);
            } catch (ExchangeApiException e) {
                return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR, "Stop update failed: " + e.getMessage(), position);
            }
        }
        String targetError = null;
        if (targetChanges) {
            try {
                updated = withTarget(updated, newTarget, replaceTargetOrder(position, newTarget));
            } catch (ExchangeApiException e) {
                targetError = e.getMessage();
            }
        }
        final GuardianPosition desired = updated;
        GuardianActionResult result = persist(position, desired,
                latest -> !stopChanges || tightens(latest.getDirection(), latest.getCurrentStop(), newStop)
                        ? latest.toBuilder()
                        .currentStop(desired.getCurrentStop()).slOrderId(desired.getSlOrderId())
                        .previousStop(desired.getPreviousStop()).previousLevel(desired.getPreviousLevel())
                        .currentTarget(desired.getCurrentTarget()).tpOrderId(desired.getTpOrderId())
                        .lastAdjustmentTs(nextVersion(latest))
                        .build()
                        : null,
                GuardianResultCode.APPLIED, "Stop " + desired.getCurrentStop() + ", target " + desired.getCurrentTarget());
        if (targetError != null && stopChanges) {
            return new GuardianActionResult(false, GuardianActionResult.Status.FAILED, GuardianResultCode.EXCHANGE_ERROR,
                    "Stop moved to " + newStop + " but target update failed: " + targetError,
                    result.position(), result.degradedState(), true);
        }
        if (targetError != null) {
            return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR, "Target update failed: " + targetError, position);
        }
        return result;
    }

    private GuardianActionResult halfCloseLocked(LivePosition live, boolean moveToBreakEven) {
        GuardianPosition position = live.position();
        ExchangeFilters filters = live.filters();
        BigDecimal held = live.exchange().quantity();
        BigDecimal half = MoneyUtils.floorToStep(held.divide(TWO), filters.stepSize());
        if (half.signum() <= 0 || (filters.minQty() != null && half.compareTo(filters.minQty()) < 0)) {
            return GuardianActionResult.rejected(GuardianResultCode.INVALID_QUANTITY,
                    "Half of " + held + " is below the minimum order size", position);
        }
        OrderAck fill;
        try {
            fill = exchangeCallExecutor.call("halfClose", () -> exchangeGateway.placeMarketOrder(
                    position.getAccountId(), position.getSymbol(), OrderSide.closing(position.getDirection()), half, true));
        } catch (ExchangeApiException e) {
            return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR, "Half close failed: " + e.getMessage(), position);
        }
        BigDecimal fillPrice = fill.avgPrice() != null ? fill.avgPrice() : marketDataCacheService.markPrice(position.getSymbol());
        BigDecimal realized = MoneyUtils.add(position.getRealizedPnl(),
                MoneyUtils.pnl(position.getDirection().isLong(), position.getEntryPrice(), fillPrice, half));
        BigDecimal remaining = held.subtract(half);
        UnaryOperator<GuardianPosition> reduce = p -> p.toBuilder()
                .quantity(remaining)
                .realizedPnl(realized)
                .lastAdjustmentTs(nextVersion(p))
                .build();
        GuardianActionResult reduced = persist(position, reduce.apply(position), reduce,
                GuardianResultCode.HALF_CLOSED, "Closed " + half + " at " + fillPrice + ", " + remaining + " remaining");
        if (!moveToBreakEven || !reduced.success()) {
            return reduced;
        }

        GuardianPosition afterReduce = reduced.position();
        BigDecimal breakEven;
        GuardianActionResult stopMove;
        try {
            breakEven = breakEvenStop(afterReduce, filters.tickSize());
            stopMove = adjustStopLocked(new LivePosition(afterReduce, live.exchange(), filters), breakEven,
                    new LevelMetadata("BREAK_EVEN", null));
        } catch (MarketDataUnavailableException e) {
            return reduced.withPartialFailure("break-even stop not moved: " + e.getMessage());
        }
        if (stopMove.success()) {
            return new GuardianActionResult(true, GuardianActionResult.Status.SUCCESS, GuardianResultCode.HALF_CLOSED,
                    reduced.message() + "; stop at break-even " + breakEven, stopMove.position(),
                    reduced.degradedState() || stopMove.degradedState(), false);
        }
        if (stopMove.code() == GuardianResultCode.LOOSER_STOP_REJECTED) {
            return GuardianActionResult.success(GuardianResultCode.HALF_CLOSED,
                    reduced.message() + "; stop already beyond break-even", afterReduce)
                    .withDegradedState(reduced.degradedState());
        }
        return reduced.withPartialFailure("break-even stop not moved: " + stopMove.message());
    }

    // ---- shared plumbing ----

    private record LivePosition(GuardianPosition position, ExchangePosition exchange, ExchangeFilters filters) {}

    private GuardianActionResult run(String operation, String accountId, String symbol, Map<String, Object> params,
                                     Supplier<GuardianActionResult> action) {
        String normalized = symbol.toUpperCase(Locale.ROOT);
        MDC.put(ACCOUNT_ID_KEY, accountId);
        try {
            return runLocked(operation, accountId, normalized, params, action);
        } finally {
            MDC.remove(ACCOUNT_ID_KEY);
        }
    }

    private GuardianActionResult runLocked(String operation, String accountId, String normalized,
                                           Map<String, Object> params, Supplier<GuardianActionResult> action) {
        String key = PositionStore.key(accountId, normalized);
        GuardianActionResult result = null;
        ReentrantLock lock = null;
        try {
            lock = acquire(key);
            if (lock == null) {
                result = GuardianActionResult.failed(GuardianResultCode.CONFLICT,
                        "Another action on " + normalized + " is still running", null);
            } else {
                result = action.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = GuardianActionResult.failed(GuardianResultCode.CONFLICT, "Interrupted waiting for position lock", null);
        } catch (MarketDataUnavailableException e) {
            result = GuardianActionResult.failed(GuardianResultCode.MARKET_DATA_UNAVAILABLE, e.getMessage(), null);
        } finally {
            if (lock != null) {
                release(key, lock, result != null && (result.code() == GuardianResultCode.CLOSED
                        || result.code() == GuardianResultCode.NO_POSITION));
            }
        }
        log.info("Guardian {} account={} symbol={} -> {} {} degraded={} partial={}", operation, accountId, normalized,
                result.status(), result.code(), result.degradedState(), result.partialFailure());
        metricsService.recordGuardianAction(operation, result.code().name());
        auditEventService.record(accountId, normalized, operation, params, auditResult(result), result.success(),
                result.success() ? null : result.message());
        return result;
    }

    private GuardianActionResult withPosition(String accountId, String symbol,
                                              java.util.function.Function<LivePosition, GuardianActionResult> action) {
        String normalized = symbol.toUpperCase(Locale.ROOT);
        Optional<GuardianPosition> stored;
        try {
            stored = positionStore.find(accountId, normalized);
        } catch (RuntimeException e) {
            log.error("Position store read failed for account={} symbol={}", accountId, normalized, e);
            return GuardianActionResult.failed(GuardianResultCode.STATE_UNAVAILABLE,
                    "Position state unavailable: " + e.getMessage(), null);
        }
        if (stored.isEmpty()) {
            return GuardianActionResult.rejected(GuardianResultCode.NO_POSITION, "No tracked position on " + normalized, null);
        }
        GuardianPosition position = stored.get();
        Optional<ExchangePosition> onExchange;
        try {
            onExchange = exchangeCallExecutor.call("position",
                    () -> exchangeGateway.getPosition(accountId, normalized));
        } catch (ExchangeApiException e) {
            return GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR,
                    "Position lookup failed: " + e.getMessage(), position);
        }
        if (onExchange.isEmpty() || onExchange.get().isFlat()) {
            return reconcileExternalFlat(position);
        }
        ExchangeFilters filters = marketDataCacheService.exchangeFilters(normalized);
        return action.apply(new LivePosition(position, onExchange.get(), filters));
    }

    private GuardianActionResult reconcileExternalFlat(GuardianPosition position) {
        DetectedExit exit = detectExit(position);
        log.warn("Position account={} symbol={} is flat on the exchange ({}); closing local record",
                position.getAccountId(), position.getSymbol(), exit.reason());
        completeHistory(position, exit.price(), exit.reason(), position.getQuantity());
        boolean degraded = !deleteWithRetry(position);
        return GuardianActionResult.rejected(GuardianResultCode.NO_POSITION,
                "Position already flat on exchange", position).withDegradedState(degraded);
    }

    /**
     * @return the held lock for the key, or null when it could not be taken within the lock timeout
     */
    private ReentrantLock acquire(String key) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(guardianProperties.getLockTimeoutMillis());
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            if (!lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                return null;
            }
            // a lock dropped from the map while we waited on it no longer guards the key
            if (locks.get(key) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private void release(String key, ReentrantLock lock, boolean positionGone) {
        if (positionGone) {
            locks.remove(key, lock);
        }
        lock.unlock();
    }

    private record DetectedExit(ExitReason reason, BigDecimal price) {}

    /**
     * Works out how a position that is flat on the exchange was closed, from the state of its
     * protective orders. A protective order left open after the other one filled is cancelled.
     */
    private DetectedExit detectExit(GuardianPosition position) {
        Optional<OrderAck> stop = orderState(position, position.getSlOrderId());
        Optional<OrderAck> target = orderState(position, position.getTpOrderId());
        if (stop.isPresent() && stop.get().isFilled()) {
            cancelIfWorking(position, target);
            return new DetectedExit(ExitReason.STOP_HIT, fillPrice(stop.get(), position.getCurrentStop()));
        }
        if (target.isPresent() && target.get().isFilled()) {
            cancelIfWorking(position, stop);
            return new DetectedExit(ExitReason.TARGET_HIT, fillPrice(target.get(), position.getCurrentTarget()));
        }
        boolean stopWorking = stop.isPresent() && stop.get().isWorking();
        boolean targetWorking = target.isPresent() && target.get().isWorking();
        if (stopWorking && !targetWorking && position.getTpOrderId() != null) {
            cancelIfWorking(position, stop);
            return new DetectedExit(ExitReason.TARGET_HIT, position.getCurrentTarget());
        }
        if (targetWorking && !stopWorking && position.getSlOrderId() != null) {
            cancelIfWorking(position, target);
            return new DetectedExit(ExitReason.STOP_HIT, position.getCurrentStop());
        }
        cancelIfWorking(position, stop);
        cancelIfWorking(position, target);
        return new DetectedExit(ExitReason.EXTERNAL_FLAT, markOrNull(position.getSymbol()));
    }

    private Optional<OrderAck> orderState(GuardianPosition position, String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        try {
            return exchangeCallExecutor.call("orderStatus",
                    () -> exchangeGateway.getOrder(position.getAccountId(), position.getSymbol(), orderId));
        } catch (ExchangeApiException e) {
            log.warn("Order {} lookup failed for account={} symbol={}: {}", orderId, position.getAccountId(),
                    position.getSymbol(), e.getMessage());
            return Optional.empty();
        }
    }

    private void cancelIfWorking(GuardianPosition position, Optional<OrderAck> order) {
        if (order.isPresent() && order.get().isWorking()) {
            cancelQuietly(position, order.get().orderId());
        }
    }

    private static BigDecimal fillPrice(OrderAck fill, BigDecimal trigger) {
        return fill.avgPrice() != null && fill.avgPrice().signum() > 0 ? fill.avgPrice() : trigger;
    }

    private static GuardianPosition fromHistory(TradeHistory trade) {
        return GuardianPosition.builder()
                .accountId(trade.getAccountId())
                .strategyId(trade.getStrategyId())
                .symbol(trade.getSymbol())
                .direction(trade.getDirection())
                .entryPrice(trade.getEntryPrice())
                .quantity(trade.getQuantity())
                .currentStop(trade.getStopPrice())
                .currentTarget(trade.getTargetPrice())
                .orderId(trade.getOrderId())
                .slOrderId(trade.getSlOrderId())
                .tpOrderId(trade.getTpOrderId())
                .tradeId(trade.getId())
                .realizedPnl(MoneyUtils.ZERO)
                .build();
    }

    /**
     * Writes {@code updated} if the stored record is still the version we read. When a newer version
     * is found, {@code rebase} re-applies the change on top of it or returns null to give up.
     */
    private GuardianActionResult persist(GuardianPosition expected, GuardianPosition updated,
                                         UnaryOperator<GuardianPosition> rebase,
                                         GuardianResultCode code, String message) {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                PositionStore.ReplaceResult write = positionStore.replace(expected, updated);
                if (write.applied()) {
                    return GuardianActionResult.success(code, message, updated);
                }
                GuardianPosition latest = write.current();
                GuardianPosition rebased = latest == null ? null : rebase.apply(latest);
                if (rebased != null && positionStore.replace(latest, rebased).applied()) {
                    log.info("Rebased {} onto newer position version for account={} symbol={}", code,
                            updated.getAccountId(), updated.getSymbol());
                    return GuardianActionResult.success(code, message, rebased);
                }
                alertService.sendAlert(AlertService.Severity.CRITICAL, "POSITION_CONFLICT", updated.getAccountId(),
                        updated.getSymbol(), "Exchange updated but position record changed concurrently: " + message);
                return new GuardianActionResult(false, GuardianActionResult.Status.FAILED, GuardianResultCode.CONFLICT,
                        "Concurrent update on position; exchange already reflects: " + message, latest, false, false);
            } catch (RuntimeException e) {
                log.warn("Position write attempt {} failed for account={} symbol={}: {}", attempt,
                        updated.getAccountId(), updated.getSymbol(), e.getMessage());
                if (attempt == 1 && !pauseBeforeRetry()) {
                    break;
                }
            }
        }
        metricsService.incrementDegradedStateWrites();
        alertService.sendAlert(AlertService.Severity.CRITICAL, "DEGRADED_STATE", updated.getAccountId(),
                updated.getSymbol(), "Exchange updated but position record not written: " + message);
        return GuardianActionResult.success(code, message, updated).withDegradedState(true);
    }

    private void completeHistory(GuardianPosition position, BigDecimal exitPrice, ExitReason reason, BigDecimal quantity) {
        try {
            tradeHistoryService.completeExit(position.getTradeId(), exitPrice, reason, position.getRealizedPnl(),
                    quantity, Instant.now());
        } catch (RuntimeException e) {
            log.error("Trade history exit {} not recorded for account={} symbol={}", reason, position.getAccountId(),
                    position.getSymbol(), e);
            alertService.sendAlert(AlertService.Severity.WARNING, "HISTORY_WRITE_FAILED", position.getAccountId(),
                    position.getSymbol(), "Exit " + reason + " not recorded for trade " + position.getTradeId());
        }
    }

    private boolean deleteWithRetry(GuardianPosition position) {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                positionStore.delete(position.getAccountId(), position.getSymbol());
                return true;
            } catch (RuntimeException e) {
                log.warn("Position delete attempt {} failed for account={} symbol={}: {}", attempt,
                        position.getAccountId(), position.getSymbol(), e.getMessage());
                if (attempt == 1 && !pauseBeforeRetry()) {
                    break;
                }
            }
        }
        metricsService.incrementDegradedStateWrites();
        alertService.sendAlert(AlertService.Severity.CRITICAL, "DEGRADED_STATE", position.getAccountId(),
                position.getSymbol(), "Position closed on exchange but record not deleted");
        return false;
    }

    private boolean pauseBeforeRetry() {
        try {
            Thread.sleep(guardianProperties.getStateWriteRetryDelayMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String replaceStopOrder(GuardianPosition position, BigDecimal newStop) {
        cancelQuietly(position, position.getSlOrderId());
        try {
            return exchangeCallExecutor.call("placeStop", () -> exchangeGateway.placeStopMarket(position.getAccountId(),
                    position.getSymbol(), OrderSide.closing(position.getDirection()), newStop)).orderId();
        } catch (ExchangeApiException e) {
            alertService.sendAlert(AlertService.Severity.CRITICAL, "STOP_MISSING", position.getAccountId(),
                    position.getSymbol(), "Stop cancelled but replacement at " + newStop + " failed: " + e.getMessage());
            throw e;
        }
    }

    private String replaceTargetOrder(GuardianPosition position, BigDecimal newTarget) {
        cancelQuietly(position, position.getTpOrderId());
        return exchangeCallExecutor.call("placeTarget", () -> exchangeGateway.placeTakeProfitMarket(position.getAccountId(),
                position.getSymbol(), OrderSide.closing(position.getDirection()), newTarget)).orderId();
    }

    private void cancelQuietly(GuardianPosition position, String orderId) {
        if (orderId == null) {
            return;
        }
        try {
            exchangeCallExecutor.run("cancelOrder",
                    () -> exchangeGateway.cancelOrder(position.getAccountId(), position.getSymbol(), orderId));
        } catch (ExchangeApiException e) {
            log.warn("Cancel of order {} for account={} symbol={} failed: {}", orderId, position.getAccountId(),
                    position.getSymbol(), e.getMessage());
        }
    }

    private BigDecimal breakEvenStop(GuardianPosition position, BigDecimal tick) {
        BigDecimal mark = marketDataCacheService.markPrice(position.getSymbol());
        BigDecimal stop = MoneyUtils.roundToTick(position.getEntryPrice(), tick);
        BigDecimal step = tick != null && tick.signum() > 0 ? tick : BigDecimal.ZERO;
        if (position.getDirection().isLong() && stop.compareTo(mark) >= 0) {
            return mark.subtract(step);
        }
        if (!position.getDirection().isLong() && stop.compareTo(mark) <= 0) {
            return mark.add(step);
        }
        return stop;
    }

    private BigDecimal markOrNull(String symbol) {
        try {
            return marketDataCacheService.markPrice(symbol);
        } catch (MarketDataUnavailableException e) {
            log.warn("No mark price for {} when recording exit: {}", symbol, e.getMessage());
            return null;
        }
    }

    private GuardianPosition withStop(GuardianPosition base, BigDecimal newStop, String slOrderId, LevelMetadata level) {
        GuardianPosition.GuardianPositionBuilder builder = base.toBuilder()
                .previousStop(base.getCurrentStop())
                .currentStop(newStop)
                .slOrderId(slOrderId)
                .lastAdjustmentTs(nextVersion(base));
        if (level != null) {
            builder.previousLevel(base.getLevelApplied())
                    .levelApplied(level.level())
                    .levelThresholdPct(level.thresholdPct());
        }
        return builder.build();
    }

    private GuardianPosition withTarget(GuardianPosition base, BigDecimal newTarget, String tpOrderId) {
        return base.toBuilder()
                .currentTarget(newTarget)
                .tpOrderId(tpOrderId)
                .lastAdjustmentTs(nextVersion(base))
                .build();
    }

    private static long nextVersion(GuardianPosition base) {
        return Math.max(System.currentTimeMillis(), base.getLastAdjustmentTs() + 1);
    }

    static boolean tightens(Direction direction, BigDecimal currentStop, BigDecimal newStop) {
        if (currentStop == null) {
            return true;
        }
        return direction.isLong() ? newStop.compareTo(currentStop) >= 0 : newStop.compareTo(currentStop) <= 0;
    }

    static boolean stopPlacementValid(Direction direction, BigDecimal stop, BigDecimal mark) {
        return direction.isLong() ? stop.compareTo(mark) < 0 : stop.compareTo(mark) > 0;
    }

    static boolean targetPlacementValid(Direction direction, BigDecimal target, BigDecimal mark) {
        return direction.isLong() ? target.compareTo(mark) > 0 : target.compareTo(mark) < 0;
    }

    private static boolean sameLevel(BigDecimal a, BigDecimal b) {
        return a != null && b != null && a.compareTo(b) == 0;
    }

    private static Map<String, Object> auditResult(GuardianActionResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", result.status());
        map.put("code", result.code());
        map.put("degradedState", result.degradedState());
        map.put("partialFailure", result.partialFailure());
        if (result.position() != null) {
            map.put("stop", result.position().getCurrentStop());
            map.put("target", result.position().getCurrentTarget());
            map.put("quantity", result.position().getQuantity());
        }
        return map;
    }
}
