package com.autonomous.approval.service;

import com.autonomous.approval.exception.PlatformUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide gate in front of every Slack call. A call may only start once
 * the current delay has elapsed since the previous one. Throttling responses
 * double the delay up to the cap; it never shrinks again until restart.
 */
@Slf4j
@Service
public class PlatformRateLimiter {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Clock clock;
    private final long maxDelayMs;

    private Sleeper sleeper = Thread::sleep;
    private Instant lastCallAt;
    private long currentDelayMs;

    public PlatformRateLimiter(Clock clock,
                               @Value("${approval.rate-limit.initial-delay-ms:1000}") long initialDelayMs,
                               @Value("${approval.rate-limit.max-delay-ms:10000}") long maxDelayMs) {
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(String.format(
                "Invalid rate limit: initial=%dms, max=%dms", initialDelayMs, maxDelayMs));
        }
        this.clock = clock;
        this.currentDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the caller may issue its Slack call. Callers are served one
     * at a time, so the gate also fixes a global order on outbound calls.
     */
    public synchronized void acquire() {
        if (lastCallAt != null) {
            long elapsed = Duration.between(lastCallAt, clock.instant()).toMillis();
            long wait = currentDelayMs - elapsed;
            if (wait > 0) {
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PlatformUnavailableException("rate-limit", "Interrupted while waiting for the Slack rate limit", e);
                }
            }
        }
        lastCallAt = clock.instant();
    }

    public synchronized long onThrottled() {
        long previous = currentDelayMs;
        currentDelayMs = Math.min(currentDelayMs * 2, maxDelayMs);
        log.warn("[RateLimit] Slack throttled us, delay {}ms -> {}ms", previous, currentDelayMs);
        return currentDelayMs;
    }

    public synchronized long getCurrentDelayMs() {
        return currentDelayMs;
    }

    public synchronized Instant getLastCallAt() {
        return lastCallAt;
    }
}
