package com.netbet.bybit.stream;

/** Thrown when a session cannot be established within its retry budget. */
public class ConnectionException extends Exception {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
