package com.apex.guardian.core;

import java.time.Duration;
import java.util.Optional;

/**
 * A small abstraction over a shared key-value store with TTL semantics.
 * Holds position records, cached market facts and trade pause flags.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - TTL of null or non-positive means "no expiry".
 *  - compareAndSet(...) replaces the value only when the stored value equals {@code expected};
 *    a null {@code expected} means the key must be absent.
 */
public interface FastStateStore {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean compareAndSet(String key, String expected, String value, Duration ttl);
}
