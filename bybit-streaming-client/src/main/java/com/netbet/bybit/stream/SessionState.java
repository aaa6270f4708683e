package com.netbet.bybit.stream;

/**
 * Lifecycle of a {@link ConnectionSession}. Only {@link #CONNECTED} permits sends; {@link #CLOSED} is terminal.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    CLOSING,
    CLOSED;

    public boolean isTerminating() {
        return this == CLOSING || this == CLOSED;
    }
}
