package com.netbet.bybit.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.subscription.Subscription;
import com.netbet.bybit.subscription.SubscriptionRegistry;
import com.netbet.bybit.subscription.TopicMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized routing for inbound frames. Frames carrying a topic are data frames and go to the
 * registry handler; frames carrying an op are control frames (heartbeat acks, request acks).
 * Runs on the session receive thread; handler failures and malformed frames stop here.
 */
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);
    private static final int LOG_FRAME_CHARS = 256;

    private final ObjectMapper objectMapper;
    private final SubscriptionRegistry registry;
    private final HeartbeatHandler heartbeatHandler;
    private final StatusHandler statusHandler;

    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();

    public MessageRouter(ObjectMapper objectMapper,
                         SubscriptionRegistry registry,
                         HeartbeatHandler heartbeatHandler,
                         StatusHandler statusHandler) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.heartbeatHandler = heartbeatHandler;
        this.statusHandler = statusHandler;
    }

    /**
     * Route one text frame. Never throws.
     */
    public void route(String frame, long receivedTimeMs) {
        if (frame == null || frame.isBlank()) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            malformed.incrementAndGet();
            log.warn("Dropping malformed frame ({}): {}", e.getOriginalMessage(), abbreviate(frame));
            return;
        }
        if (root == null || !root.isObject()) {
            malformed.incrementAndGet();
            log.warn("Dropping non-object frame: {}", abbreviate(frame));
            return;
        }

        String topic = root.path("topic").asText(null);
        if (topic != null && !topic.isEmpty()) {
            dispatch(topic, root, receivedTimeMs);
            return;
        }

        String op = root.path("op").asText("");
        switch (op) {
            case "pong", "ping" -> heartbeatHandler.handle(root);
            case "subscribe", "unsubscribe", "auth" -> statusHandler.handle(op, root);
            default -> log.trace("Unhandled frame op={}", op);
        }
    }

    public RouterStats stats() {
        return new RouterStats(dispatched.get(), dropped.get(), malformed.get(), handlerFailures.get());
    }

    private void dispatch(String topic, JsonNode root, long receivedTimeMs) {
        Subscription subscription = registry.findActive(topic);
        if (subscription == null) {
            dropped.incrementAndGet();
            log.debug("Dropping frame for inactive topic {}", topic);
            return;
        }
        String type = root.path("type").asText(null);
        long ts = root.path("ts").asLong(-1);
        TopicMessage message = new TopicMessage(topic, type, root.path("data"), ts, receivedTimeMs);
        try {
            subscription.handler().onMessage(message);
            registry.recordDelivery(subscription, receivedTimeMs);
            dispatched.incrementAndGet();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            handlerFailures.incrementAndGet();
            log.error("Handler failed for topic={} type={} ts={}: {}", topic, type, ts, e.getMessage(), e);
        }
    }

    private static String abbreviate(String frame) {
        return frame.length() <= LOG_FRAME_CHARS ? frame : frame.substring(0, LOG_FRAME_CHARS) + "...";
    }
}
