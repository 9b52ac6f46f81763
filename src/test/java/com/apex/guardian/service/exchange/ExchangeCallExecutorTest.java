package com.apex.guardian.service.exchange;

import com.apex.guardian.config.ExchangeResilienceConfig;
import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.exception.ExchangeApiException;
import com.apex.guardian.exception.ExchangeTransientException;
import com.apex.guardian.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeCallExecutorTest {

    private ExchangeCallExecutor executor;

    @BeforeEach
    void setUp() {
        ExecutionProperties executionProperties = new ExecutionProperties();
        executionProperties.getExchange().setRetryMaxAttempts(3);
        executionProperties.getExchange().setRetryBaseDelayMillis(1);
        executionProperties.getExchange().setRetryJitterFactor(0.0);
        executionProperties.getExchange().setCallTimeoutMillis(100);
        ExchangeResilienceConfig config = new ExchangeResilienceConfig(executionProperties);
        executor = new ExchangeCallExecutor(config.exchangeRetry(), config.exchangeRateLimiter(),
                config.exchangeTimeLimiter(), new SimpleAsyncTaskExecutor("exchange-test-"), TestFixtures.metrics());
    }

    @Test
    void transientFailuresAreRetried() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.call("balance", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ExchangeTransientException("timeout");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.call("entry", () -> {
            attempts.incrementAndGet();
            throw new ExchangeApiException("insufficient margin", -2019, null);
        })).isInstanceOf(ExchangeApiException.class).hasMessage("insufficient margin");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void unexpectedErrorsAreWrapped() {
        assertThatThrownBy(() -> executor.call("openOrders", () -> {
            throw new IllegalStateException("boom");
        })).isExactlyInstanceOf(ExchangeApiException.class).hasMessageContaining("openOrders");
    }

    @Test
    void slowCallsTimeOutWithoutRetryAndAreInterrupted() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean interrupted = new AtomicBoolean();

        assertThatThrownBy(() -> executor.call("entry", () -> {
            attempts.incrementAndGet();
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
            return "late";
        })).isExactlyInstanceOf(ExchangeApiException.class)
                .hasMessageContaining("timed out")
                .hasCauseInstanceOf(TimeoutException.class);

        Thread.sleep(200);
        assertThat(attempts).hasValue(1);
        assertThat(interrupted).isTrue();
    }
}
