package com.netbet.bybit.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff + jitter for connect attempts: base x 2^attempt, capped at the max delay,
 * randomized in the upper half of that window. Defaults: 0.5s to 30s.
 */
public class ReconnectPolicy {

    private static final Logger log = LoggerFactory.getLogger(ReconnectPolicy.class);
    private static final long DEFAULT_BASE_DELAY_MS = 500;
    private static final long DEFAULT_MAX_DELAY_MS = 30_000;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private int attempt;

    public ReconnectPolicy() {
        this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public ReconnectPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Require 0 < baseDelayMs <= maxDelayMs, got " + baseDelayMs + "/" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.attempt = 0;
    }

    /**
     * Returns delay in milliseconds for the next reconnect attempt (with jitter).
     */
    public synchronized long nextDelayMs() {
        long exponential = (long) Math.min(maxDelayMs, baseDelayMs * Math.pow(2, attempt));
        long half = exponential / 2;
        long jitter = ThreadLocalRandom.current().nextLong(0, half + 1);
        long delay = Math.max(baseDelayMs, Math.min(maxDelayMs, half + jitter));
        attempt++;
        log.info("Reconnect attempt {}: waiting {} ms (backoff + jitter)", attempt, delay);
        return delay;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized void reset() {
        attempt = 0;
    }
}
