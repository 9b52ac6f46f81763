package com.apex.guardian.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter degradedStateWritesCounter;
    private Counter exchangeFailuresCounter;
    private Counter signalsReceivedCounter;

    @PostConstruct
    void init() {
        degradedStateWritesCounter = Counter.builder("guardian_degraded_state_writes_total").register(meterRegistry);
        exchangeFailuresCounter = Counter.builder("guardian_exchange_failures_total").register(meterRegistry);
        signalsReceivedCounter = Counter.builder("guardian_signals_received_total").register(meterRegistry);
    }

    public void incrementSignalsReceived() {
        if (signalsReceivedCounter != null) {
            signalsReceivedCounter.increment();
        }
    }

    public void recordDispatchOutcome(String status) {
        meterRegistry.counter("guardian_dispatch_outcomes_total", "status", status).increment();
    }

    public void recordRiskRejection(String code) {
        meterRegistry.counter("guardian_risk_rejections_total", "code", code).increment();
    }

    public void recordCacheLookup(String kind, String result) {
        meterRegistry.counter("guardian_market_cache_total", "kind", kind, "result", result).increment();
    }

    public void recordAlert(String severity) {
        meterRegistry.counter("guardian_alerts_total", "severity", severity).increment();
    }

    public void recordGuardianAction(String action, String code) {
        meterRegistry.counter("guardian_actions_total", "action", action, "code", code).increment();
    }

    public void incrementDegradedStateWrites() {
        if (degradedStateWritesCounter != null) {
            degradedStateWritesCounter.increment();
        }
    }

    public void incrementExchangeFailures() {
        if (exchangeFailuresCounter != null) {
            exchangeFailuresCounter.increment();
        }
    }
}
