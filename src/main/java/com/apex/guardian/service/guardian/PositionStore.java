package com.apex.guardian.service.guardian;

import com.apex.guardian.config.GuardianProperties;
import com.apex.guardian.core.FastStateStore;
import com.apex.guardian.exception.PositionConflictException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Position records as JSON in the fast store. Updates are conditional on the stored
 * {@code lastAdjustmentTs} still matching the version the caller read.
 */
@Component
@RequiredArgsConstructor
public class PositionStore {

    private final FastStateStore fastStateStore;
    private final GuardianProperties guardianProperties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param current the stored record when the write was not applied, null when the key is gone
     */
    public record ReplaceResult(boolean applied, GuardianPosition current) {}

    public Optional<GuardianPosition> find(String accountId, String symbol) {
        return fastStateStore.get(key(accountId, symbol)).map(this::read);
    }

    /**
     * Stores a newly opened position.
     *
     * @throws PositionConflictException if a position is already tracked for the account and symbol
     */
    public void create(GuardianPosition position) {
        String key = key(position.getAccountId(), position.getSymbol());
        if (!fastStateStore.setIfAbsent(key, write(position), ttl())) {
            throw new PositionConflictException("Position already tracked for " + key);
        }
    }

    public ReplaceResult replace(GuardianPosition expected, GuardianPosition updated) {
        String key = key(updated.getAccountId(), updated.getSymbol());
        Optional<String> raw = fastStateStore.get(key);
        if (raw.isEmpty()) {
            return new ReplaceResult(false, null);
        }
        GuardianPosition current = read(raw.get());
        if (current.getLastAdjustmentTs() != expected.getLastAdjustmentTs()) {
            return new ReplaceResult(false, current);
        }
        if (fastStateStore.compareAndSet(key, raw.get(), write(updated), ttl())) {
            return new ReplaceResult(true, updated);
        }
        return new ReplaceResult(false, find(updated.getAccountId(), updated.getSymbol()).orElse(null));
    }

    public void delete(String accountId, String symbol) {
        fastStateStore.delete(key(accountId, symbol));
    }

    private Duration ttl() {
        return Duration.ofHours(guardianProperties.getPositionTtlHours());
    }

    private GuardianPosition read(String json) {
        try {
            return objectMapper.readValue(json, GuardianPosition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt position record: " + e.getOriginalMessage(), e);
        }
    }

    private String write(GuardianPosition position) {
        try {
            return objectMapper.writeValueAsString(position);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Position record not serializable: " + e.getOriginalMessage(), e);
        }
    }

    static String key(String accountId, String symbol) {
        return "position:" + accountId + ":" + symbol.toUpperCase(Locale.ROOT);
    }
}
