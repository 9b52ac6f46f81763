package com.apex.guardian.service.execution;

import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.model.Direction;
import com.apex.guardian.service.AlertService;
import com.apex.guardian.service.exchange.ExchangeCallExecutor;
import com.apex.guardian.service.exchange.ExchangeGateway;
import com.apex.guardian.service.exchange.OrderSide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Places the stop-loss and take-profit that protect a freshly filled entry. Placement is retried
 * a configured number of times; a position that stays unprotected raises a critical alert and is
 * never rolled back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProtectiveOrderService {

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final ExecutionProperties executionProperties;
    private final AlertService alertService;

    public record Protection(String slOrderId, String tpOrderId, String failure) {

        public boolean isComplete() {
            return failure == null;
        }
    }

    public Protection protect(String accountId, String symbol, Direction direction, BigDecimal stop, BigDecimal target) {
        OrderSide closingSide = OrderSide.closing(direction);
        StringBuilder failure = new StringBuilder();

        String slOrderId = placeWithRetry("stop", accountId, symbol, failure,
                () -> exchangeGateway.placeStopMarket(accountId, symbol, closingSide, stop).orderId());
        String tpOrderId = placeWithRetry("target", accountId, symbol, failure,
                () -> exchangeGateway.placeTakeProfitMarket(accountId, symbol, closingSide, target).orderId());

        if (failure.length() > 0) {
            alertService.sendAlert(AlertService.Severity.CRITICAL, "UNPROTECTED_POSITION", accountId, symbol,
                    "Entry filled but protective orders missing: " + failure);
            return new Protection(slOrderId, tpOrderId, failure.toString());
        }
        return new Protection(slOrderId, tpOrderId, null);
    }

    private String placeWithRetry(String kind, String accountId, String symbol, StringBuilder failure,
                                  Supplier<String> placement) {
        int attempts = executionProperties.getProtectiveRetryAttempts() + 1;
        String lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return exchangeCallExecutor.call("place-" + kind, placement);
            } catch (ExchangeApiException e) {
                lastError = e.getMessage();
                log.warn("Protective {} attempt {}/{} failed for account={} symbol={}: {}", kind, attempt, attempts,
                        accountId, symbol, lastError);
                if (attempt < attempts && !sleep(executionProperties.getProtectiveRetryDelayMillis())) {
                    break;
                }
            }
        }
        if (failure.length() > 0) {
            failure.append("; ");
        }
        failure.append(kind).append(" failed: ").append(lastError);
        return null;
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
