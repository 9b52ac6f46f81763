package com.apex.guardian.service;

import com.apex.guardian.model.AuditEvent;
import com.apex.guardian.repository.AuditEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Append-only record of risk decisions, guardian actions and alerts. A failed audit write is
 * logged and never fails the operation being audited.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String RISK_EVALUATION = "RISK_EVALUATION";
    public static final String ALERT = "ALERT";

    private static final int MAX_ERROR_LENGTH = 1024;

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public void record(String accountId, String symbol, String operation, Object params, Object result,
                       boolean success, String error) {
        try {
            AuditEvent event = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .accountId(accountId)
                    .symbol(symbol)
                    .operation(operation)
                    .params(toJson(params))
                    .result(toJson(result))
                    .success(success)
                    .error(truncate(error))
                    .correlationId(MDC.get("correlationId"))
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {} for account={} symbol={} - {}",
                    operation, accountId, symbol, e.getMessage());
        }
    }

    private String toJson(Object value) throws Exception {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        return objectMapper.writeValueAsString(value);
    }

    private String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
