package com.apex.guardian.core;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation using StringRedisTemplate.
 * Keys are prefixed with the provided prefix (e.g., "guardian:").
 */
public final class RedisFastStateStore implements FastStateStore {

    // ARGV[3] is the TTL in millis, 0 for no expiry
    private static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "if tonumber(ARGV[3]) > 0 then redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) "
                    + "else redis.call('SET', KEYS[1], ARGV[2]) end "
                    + "return 1 else return 0 end",
            Long.class);

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisFastStateStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    private static boolean hasTtl(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        final String k = k(key);
        if (hasTtl(ttl)) {
            redis.opsForValue().set(k, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            redis.opsForValue().set(k, value);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(k(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        final String k = k(key);
        Boolean ok = hasTtl(ttl)
                ? redis.opsForValue().setIfAbsent(k, value, ttl.toMillis(), TimeUnit.MILLISECONDS)
                : redis.opsForValue().setIfAbsent(k, value);
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value, Duration ttl) {
        if (expected == null) {
            return setIfAbsent(key, value, ttl);
        }
        String ttlMillis = hasTtl(ttl) ? Long.toString(ttl.toMillis()) : "0";
        Long result = redis.execute(COMPARE_AND_SET, List.of(k(key)), expected, value, ttlMillis);
        return result != null && result == 1L;
    }
}
