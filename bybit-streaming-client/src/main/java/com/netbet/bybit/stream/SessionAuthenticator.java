package com.netbet.bybit.stream;

import java.io.IOException;
import java.time.Duration;

/**
 * Handshake run on a freshly connected transport before the session is marked connected.
 * May use {@link StreamTransport#send} and {@link StreamTransport#receive} directly; no receive
 * loop is running yet.
 */
@FunctionalInterface
public interface SessionAuthenticator {

    SessionAuthenticator NONE = (transport, timeout) -> { };

    void authenticate(StreamTransport transport, Duration timeout) throws IOException;
}
