package com.lineguard.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store for per-route alert state. Entries always carry a TTL so
 * the cache never grows past the current day's monitoring windows.
 *
 * <p>Redis errors are not caught here; callers decide how to degrade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertStateCache {

    private final StringRedisTemplate redisTemplate;

    @Value("${redis.enabled:true}")
    private boolean redisEnabled;

    public boolean isEnabled() {
        return redisEnabled;
    }

    public Optional<String> read(String key) {
        if (!redisEnabled) {
            log.trace("Redis is disabled. Skipping read for key: {}", key);
            return Optional.empty();
        }
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    /**
     * @throws IllegalArgumentException if {@code ttlSeconds} is not positive
     */
    public void write(String key, String value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttlSeconds);
        }
        if (!redisEnabled) {
            log.trace("Redis is disabled. Skipping write for key: {}", key);
            return;
        }
        redisTemplate.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds));
        log.trace("Saved to Redis: key={}, ttl={}s", key, ttlSeconds);
    }
}
