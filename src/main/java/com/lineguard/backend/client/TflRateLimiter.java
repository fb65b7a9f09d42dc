package com.lineguard.backend.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Spaces outgoing TfL requests so the application stays under the
 * per-minute quota of its app key.
 */
@Component
@Slf4j
public class TflRateLimiter {

    private final long minIntervalMs;
    private long nextSlot;

    public TflRateLimiter(@Value("${tfl.api.min-request-interval-ms:210}") long minIntervalMs) {
        this.minIntervalMs = minIntervalMs;
        this.nextSlot = System.currentTimeMillis();
    }

    /**
     * Blocks until the next request slot. Returns false if interrupted while
     * waiting; the interrupt flag is restored.
     */
    public synchronized boolean acquire() {
        long now = System.currentTimeMillis();
        long slot = Math.max(now, nextSlot);
        nextSlot = slot + minIntervalMs;
        if (slot <= now) {
            return true;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(slot - now);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ TfL rate limiter interrupted while waiting for a slot");
            return false;
        }
    }
}
