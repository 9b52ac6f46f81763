package com.apex.guardian.service.exchange;

import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.exception.ExchangeTransientException;
import com.apex.guardian.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs exchange calls under the shared rate limit, retrying transient failures with backoff.
 * Each attempt is bounded by the call timeout; a timed out attempt is not retried since the
 * exchange may still have applied it.
 */
@Slf4j
@Component
public class ExchangeCallExecutor {

    private final Retry exchangeRetry;
    private final RateLimiter exchangeRateLimiter;
    private final TimeLimiter exchangeTimeLimiter;
    private final AsyncTaskExecutor exchangeIoExecutor;
    private final MetricsService metricsService;

    public ExchangeCallExecutor(Retry exchangeRetry,
                                RateLimiter exchangeRateLimiter,
                                TimeLimiter exchangeTimeLimiter,
                                @Qualifier("exchangeIoExecutor") AsyncTaskExecutor exchangeIoExecutor,
                                MetricsService metricsService) {
        this.exchangeRetry = exchangeRetry;
        this.exchangeRateLimiter = exchangeRateLimiter;
        this.exchangeTimeLimiter = exchangeTimeLimiter;
        this.exchangeIoExecutor = exchangeIoExecutor;
        this.metricsService = metricsService;
    }

    public <T> T call(String operation, Supplier<T> supplier) {
        Callable<T> task = supplier::get;
        Callable<T> decorated = TimeLimiter.decorateFutureSupplier(exchangeTimeLimiter,
                () -> exchangeIoExecutor.submit(task));
        decorated = Retry.decorateCallable(exchangeRetry, decorated);
        decorated = RateLimiter.decorateCallable(exchangeRateLimiter, decorated);
        try {
            return decorated.call();
        } catch (RequestNotPermitted e) {
            metricsService.incrementExchangeFailures();
            log.warn("Exchange rate limit exhausted for {}", operation);
            throw new ExchangeTransientException("Exchange rate limit exhausted for " + operation, e);
        } catch (TimeoutException e) {
            metricsService.incrementExchangeFailures();
            log.warn("Exchange call {} timed out after {}", operation,
                    exchangeTimeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new ExchangeApiException("Exchange call " + operation + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metricsService.incrementExchangeFailures();
            throw new ExchangeApiException("Exchange call " + operation + " interrupted", e);
        } catch (ExchangeApiException e) {
            metricsService.incrementExchangeFailures();
            log.warn("Exchange call {} failed: {}", operation, e.getMessage());
            throw e;
        } catch (Exception e) {
            metricsService.incrementExchangeFailures();
            log.error("Exchange call {} failed unexpectedly", operation, e);
            throw new ExchangeApiException("Exchange call " + operation + " failed: " + e.getMessage(), e);
        }
    }

    public void run(String operation, Runnable runnable) {
        call(operation, () -> {
            runnable.run();
            return null;
        });
    }
}
