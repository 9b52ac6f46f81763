package com.apex.guardian.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of FastStateStore.
 * Intended for local/dev/testing only (single JVM).
 */
public final class InMemoryFastStateStore implements FastStateStore {

    private static final class Entry {
        final String v;
        final long expAtMillis; // 0 = no expiry

        Entry(String v, long expAtMillis) {
            this.v = v;
            this.expAtMillis = expAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final String prefix;

    public InMemoryFastStateStore(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    private static boolean isExpired(Entry e, long now) {
        return e != null && e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private static Entry entry(String value, Duration ttl, long now) {
        long exp = (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0L : (now + ttl.toMillis());
        return new Entry(value, exp);
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        map.put(k(key), entry(value, ttl, now()));
    }

    @Override
    public Optional<String> get(String key) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null) {
            return Optional.empty();
        }
        if (isExpired(e, now())) {
            map.remove(kk, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.v);
    }

    @Override
    public void delete(String key) {
        map.remove(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return compareAndSet(key, null, value, ttl);
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value, Duration ttl) {
        final String kk = k(key);
        for (; ; ) {
            final long n = now();
            final Entry existing = map.get(kk);
            final boolean absent = existing == null || isExpired(existing, n);
            if (expected == null ? !absent : (absent || !Objects.equals(existing.v, expected))) {
                return false;
            }
            final Entry fresh = entry(value, ttl, n);
            if (existing == null) {
                if (map.putIfAbsent(kk, fresh) == null) {
                    return true;
                }
            } else if (map.replace(kk, existing, fresh)) {
                return true;
            }
            // lost race; retry
        }
    }
}
