package com.netbet.bybit.stream;

/** Creates a fresh, unconnected transport for every connect attempt. */
@FunctionalInterface
public interface TransportFactory {

    StreamTransport create();
}
