package com.netbet.bybit.stream;

import java.io.IOException;
import java.time.Duration;

/**
 * One duplex text-frame connection. Instances are single-use: connect once, close once.
 * The session serializes {@link #send} calls; {@link #receive} is called from one thread only.
 */
public interface StreamTransport {

    /** Open the connection, blocking up to {@code timeout}. */
    void connect(Duration timeout) throws IOException;

    void send(String frame) throws IOException;

    /**
     * Next inbound frame, or null if none arrived within {@code timeout}.
     *
     * @throws IOException once the connection is lost or closed
     */
    String receive(Duration timeout) throws IOException, InterruptedException;

    /** Graceful close where supported, then release. Idempotent. */
    void close();

    boolean isOpen();
}
