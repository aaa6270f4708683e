package com.netbet.bybit.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keepalive timer for one connection at a time. Sends a ping every interval and reports staleness
 * when no inbound traffic (data or control) was seen for longer than the stale threshold.
 * Each {@link #start} acquires its own single-thread executor; {@link #stop} shuts it down and waits
 * for the timer thread, so no ping can be in flight once stop returns.
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);
    private static final long STOP_TIMEOUT_MS = 5_000;

    /** Writes one ping frame with the given request id to the live connection. */
    @FunctionalInterface
    public interface PingSender {
        void sendPing(String reqId) throws IOException;
    }

    private final String name;
    private final Duration interval;
    private final Duration staleAfter;
    private final AtomicLong pingSequence = new AtomicLong();
    private final AtomicLong lastInboundNanos = new AtomicLong(System.nanoTime());
    private final AtomicLong pingsSent = new AtomicLong();
    private final AtomicBoolean staleReported = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService executor;
    private volatile Thread timerThread;
    private volatile String lastAckRequestId;

    public HeartbeatScheduler(String name, Duration interval, Duration staleAfter) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + interval);
        }
        if (staleAfter.compareTo(interval) < 0) {
            throw new IllegalArgumentException("Stale threshold " + staleAfter + " is shorter than interval " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.staleAfter = staleAfter;
    }

    /**
     * Start pinging through {@code sender}; {@code onStale} runs at most once per start, on the timer thread.
     */
    public void start(PingSender sender, Runnable onStale) {
        synchronized (lifecycleLock) {
            if (executor != null) {
                throw new IllegalStateException("Heartbeat " + name + " already running");
            }
            lastInboundNanos.set(System.nanoTime());
            staleReported.set(false);
            ScheduledExecutorService ex = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name + "-heartbeat");
                t.setDaemon(true);
                timerThread = t;
                return t;
            });
            long intervalMs = interval.toMillis();
            long checkMs = Math.max(1, intervalMs / 4);
            ex.scheduleAtFixedRate(() -> ping(sender), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            ex.scheduleAtFixedRate(() -> checkStaleness(onStale), checkMs, checkMs, TimeUnit.MILLISECONDS);
            executor = ex;
        }
        log.debug("Heartbeat {} started (interval={} ms, staleAfter={} ms)", name, interval.toMillis(), staleAfter.toMillis());
    }

    /** Cancel the timer and wait for it to quiesce. Safe to call when not running. */
    public void stop() {
        ScheduledExecutorService ex;
        synchronized (lifecycleLock) {
            ex = executor;
            executor = null;
        }
        if (ex == null) {
            return;
        }
        ex.shutdownNow();
        if (Thread.currentThread() != timerThread) {
            try {
                if (!ex.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Heartbeat {} did not terminate within {} ms", name, STOP_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Heartbeat {} stopped", name);
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null;
        }
    }

    /** Any inbound frame counts as liveness. */
    public void recordInbound() {
        lastInboundNanos.set(System.nanoTime());
    }

    public void recordAck(String reqId) {
        recordInbound();
        lastAckRequestId = reqId;
        log.trace("Heartbeat {} ack req_id={}", name, reqId);
    }

    public long millisSinceLastInbound() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastInboundNanos.get());
    }

    public String lastAckRequestId() {
        return lastAckRequestId;
    }

    public long pingsSent() {
        return pingsSent.get();
    }

    public Duration interval() {
        return interval;
    }

    public Duration staleAfter() {
        return staleAfter;
    }

    private void ping(PingSender sender) {
        String reqId = name + "-" + pingSequence.incrementAndGet();
        try {
            sender.sendPing(reqId);
            pingsSent.incrementAndGet();
            log.trace("Heartbeat {} ping req_id={}", name, reqId);
        } catch (IOException e) {
            log.warn("Heartbeat {} ping failed: {}", name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Heartbeat {} ping failed unexpectedly", name, e);
        }
    }

    private void checkStaleness(Runnable onStale) {
        long silentMs = millisSinceLastInbound();
        if (silentMs <= staleAfter.toMillis() || !staleReported.compareAndSet(false, true)) {
            return;
        }
        log.warn("Heartbeat {}: no inbound traffic for {} ms (threshold {} ms), connection is stale",
                name, silentMs, staleAfter.toMillis());
        try {
            onStale.run();
        } catch (RuntimeException e) {
            log.error("Heartbeat {} stale callback failed", name, e);
        }
    }
}
