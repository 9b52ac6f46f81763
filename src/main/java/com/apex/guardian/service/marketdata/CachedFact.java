package com.apex.guardian.service.marketdata;

import java.time.Duration;
import java.time.Instant;

public record CachedFact<T>(T value, Instant capturedAt, FactSource source) {

    public boolean isFresh(Instant now, Duration ttl) {
        return capturedAt != null && Duration.between(capturedAt, now).compareTo(ttl) < 0;
    }
}
