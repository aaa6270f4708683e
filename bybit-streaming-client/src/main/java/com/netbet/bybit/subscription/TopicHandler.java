package com.netbet.bybit.subscription;

/**
 * Callback for data frames of one topic. Invoked on the session's receive thread, so implementations
 * must return quickly and hand slow work to another thread.
 */
@FunctionalInterface
public interface TopicHandler {

    void onMessage(TopicMessage message) throws Exception;
}
