package com.netbet.bybit.router;

/**
 * Point-in-time router counters.
 */
public record RouterStats(long dispatched, long dropped, long malformed, long handlerFailures) {
}
