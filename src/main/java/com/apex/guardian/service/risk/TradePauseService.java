package com.apex.guardian.service.risk;

import com.apex.guardian.core.FastStateStore;
import com.apex.guardian.service.AuditEventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Daily-loss pause flags. A pause lives in the fast store until its resume time and disappears on
 * its own; only a manual override deletes it earlier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradePauseService {

    static final String OPERATION_CLEAR = "CLEAR_PAUSE";

    private final FastStateStore fastStateStore;
    private final AuditEventService auditEventService;

    public record TradePause(boolean paused, Instant resumeAt) {}

    public Optional<TradePause> activePause(String accountId, String strategyId, Instant now) {
        Optional<String> raw = fastStateStore.get(key(accountId, strategyId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Instant resumeAt = Instant.ofEpochMilli(Long.parseLong(raw.get()));
        if (!now.isBefore(resumeAt)) {
            return Optional.empty();
        }
        return Optional.of(new TradePause(true, resumeAt));
    }

    public TradePause pause(String accountId, String strategyId, Instant now, Duration duration) {
        Instant resumeAt = now.plus(duration);
        fastStateStore.put(key(accountId, strategyId), Long.toString(resumeAt.toEpochMilli()), duration);
        log.warn("Trading paused for account={} strategy={} until {}", accountId, strategyId, resumeAt);
        return new TradePause(true, resumeAt);
    }

    public boolean clearPause(String accountId, String strategyId) {
        boolean existed = fastStateStore.get(key(accountId, strategyId)).isPresent();
        fastStateStore.delete(key(accountId, strategyId));
        log.info("Manual pause override for account={} strategy={} (was paused: {})", accountId, strategyId, existed);
        auditEventService.record(accountId, null, OPERATION_CLEAR, Map.of("strategyId", strategyId),
                Map.of("wasPaused", existed), true, null);
        return existed;
    }

    private static String key(String accountId, String strategyId) {
        return "pause:" + accountId + ":" + strategyId;
    }
}
