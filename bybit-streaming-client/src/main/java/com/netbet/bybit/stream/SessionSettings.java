package com.netbet.bybit.stream;

import java.time.Duration;

/**
 * Timing and retry knobs for a {@link ConnectionSession}.
 *
 * @param heartbeatInterval     ping period
 * @param staleMultiplier       connection is stale after heartbeatInterval x staleMultiplier without inbound traffic
 * @param connectTimeout        per-attempt connect (and authentication) timeout
 * @param readTimeout           receive poll timeout; bounds how long close() waits for the receive thread
 * @param reconnectBaseDelay    first backoff delay
 * @param reconnectMaxDelay     backoff cap
 * @param maxConnectAttempts    attempts per connect cycle before giving up
 */
public record SessionSettings(
        Duration heartbeatInterval,
        double staleMultiplier,
        Duration connectTimeout,
        Duration readTimeout,
        Duration reconnectBaseDelay,
        Duration reconnectMaxDelay,
        int maxConnectAttempts
) {
    public SessionSettings {
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(readTimeout, "readTimeout");
        requirePositive(reconnectBaseDelay, "reconnectBaseDelay");
        requirePositive(reconnectMaxDelay, "reconnectMaxDelay");
        if (staleMultiplier < 1.0) {
            throw new IllegalArgumentException("staleMultiplier must be >= 1.0, got " + staleMultiplier);
        }
        if (reconnectMaxDelay.compareTo(reconnectBaseDelay) < 0) {
            throw new IllegalArgumentException("reconnectMaxDelay must be >= reconnectBaseDelay");
        }
        if (maxConnectAttempts < 1) {
            throw new IllegalArgumentException("maxConnectAttempts must be >= 1, got " + maxConnectAttempts);
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(
                Duration.ofSeconds(20),
                2.0,
                Duration.ofSeconds(10),
                Duration.ofSeconds(1),
                Duration.ofMillis(500),
                Duration.ofSeconds(30),
                10);
    }

    public Duration staleAfter() {
        return Duration.ofMillis((long) (heartbeatInterval.toMillis() * staleMultiplier));
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + d);
        }
    }
}
