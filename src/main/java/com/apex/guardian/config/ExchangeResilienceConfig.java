package com.apex.guardian.config;

import com.apex.guardian.exception.ExchangeTransientException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class ExchangeResilienceConfig {

    private final ExecutionProperties executionProperties;

    @Bean
    public RateLimiter exchangeRateLimiter() {
        ExecutionProperties.Exchange cfg = executionProperties.getExchange();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(cfg.getRateLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(cfg.getRateLimitTimeoutMillis()))
                .build();
        return RateLimiter.of("exchange", config);
    }

    @Bean
    public Retry exchangeRetry() {
        ExecutionProperties.Exchange cfg = executionProperties.getExchange();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(cfg.getRetryBaseDelayMillis()),
                2.0,
                cfg.getRetryJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(cfg.getRetryMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(ExchangeTransientException.class)
                .build();
        return Retry.of("exchange", config);
    }

    @Bean
    public TimeLimiter exchangeTimeLimiter() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(executionProperties.getExchange().getCallTimeoutMillis()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("exchange", config);
    }
}
