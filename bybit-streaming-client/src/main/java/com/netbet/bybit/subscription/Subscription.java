package com.netbet.bybit.subscription;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry entry: topic, current handler and desired-active flag. Entries are flagged inactive on
 * unsubscribe rather than removed, so delivery history survives re-subscription.
 * Mutated only by {@link SubscriptionRegistry} under its write lock.
 */
public final class Subscription {

    private final String topic;
    private final long createdAt;
    private final AtomicLong deliveries = new AtomicLong();
    private volatile TopicHandler handler;
    private volatile boolean active;
    private volatile long lastDeliveryAt = -1;

    Subscription(String topic, TopicHandler handler, long createdAt) {
        this.topic = topic;
        this.handler = handler;
        this.active = true;
        this.createdAt = createdAt;
    }

    public String topic() {
        return topic;
    }

    public TopicHandler handler() {
        return handler;
    }

    public boolean isActive() {
        return active;
    }

    public long createdAt() {
        return createdAt;
    }

    public long deliveries() {
        return deliveries.get();
    }

    /** Epoch ms of the last successful handler invocation, -1 if none. */
    public long lastDeliveryAt() {
        return lastDeliveryAt;
    }

    void replaceHandler(TopicHandler handler) {
        this.handler = handler;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    void recordDelivery(long at) {
        deliveries.incrementAndGet();
        lastDeliveryAt = at;
    }

    @Override
    public String toString() {
        return "Subscription{topic=" + topic + ", active=" + active + ", deliveries=" + deliveries.get() + "}";
    }
}
