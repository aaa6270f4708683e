package com.netbet.bybit.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Durable source of "what should be subscribed", independent of the live connection.
 * Iteration order is insertion order so replay after reconnect is reproducible.
 * Dispatch lookups take the shared read lock; subscribe/unsubscribe take the write lock.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<String, Subscription> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Insert or overwrite the entry for {@code topic} and mark it active.
     *
     * @return true if the topic was not active before (an upstream subscribe is needed),
     *         false if only the handler was replaced
     */
    public boolean upsert(String topic, TopicHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        lock.writeLock().lock();
        try {
            Subscription existing = entries.get(topic);
            if (existing == null) {
                entries.put(topic, new Subscription(topic, handler, System.currentTimeMillis()));
                log.debug("Registry: added topic={}", topic);
                return true;
            }
            boolean wasActive = existing.isActive();
            existing.replaceHandler(handler);
            existing.setActive(true);
            log.debug("Registry: {} topic={}", wasActive ? "replaced handler for" : "reactivated", topic);
            return !wasActive;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Flag the entry inactive. The entry itself is kept.
     *
     * @return false if the topic is unknown or already inactive
     */
    public boolean deactivate(String topic) {
        lock.writeLock().lock();
        try {
            Subscription existing = entries.get(topic);
            if (existing == null || !existing.isActive()) {
                return false;
            }
            existing.setActive(false);
            log.debug("Registry: deactivated topic={}", topic);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Active entry for the topic, or null when absent or inactive. */
    public Subscription findActive(String topic) {
        lock.readLock().lock();
        try {
            Subscription s = entries.get(topic);
            return s != null && s.isActive() ? s : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isActive(String topic) {
        return findActive(topic) != null;
    }

    /** Snapshot of active entries in insertion order. */
    public List<Subscription> activeEntries() {
        lock.readLock().lock();
        try {
            List<Subscription> result = new ArrayList<>(entries.size());
            for (Subscription s : entries.values()) {
                if (s.isActive()) {
                    result.add(s);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot of all entries, inactive ones included. */
    public List<Subscription> entries() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int activeCount() {
        return activeEntries().size();
    }

    public void recordDelivery(Subscription subscription, long at) {
        subscription.recordDelivery(at);
    }
}
