package com.apex.guardian.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    public enum Severity {
        WARNING,
        CRITICAL
    }

    private final AuditEventService auditEventService;
    private final MetricsService metricsService;

    public void sendAlert(Severity severity, String type, String accountId, String symbol, String message) {
        if (severity == Severity.CRITICAL) {
            log.error("[ALERT {}] {} account={} symbol={} - {}", severity, type, accountId, symbol, message);
        } else {
            log.warn("[ALERT {}] {} account={} symbol={} - {}", severity, type, accountId, symbol, message);
        }
        metricsService.recordAlert(severity.name());
        auditEventService.record(accountId, symbol, AuditEventService.ALERT,
                Map.of("severity", severity.name(), "type", type), message, false, message);
    }
}
