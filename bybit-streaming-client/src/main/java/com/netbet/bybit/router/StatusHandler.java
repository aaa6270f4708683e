package com.netbet.bybit.router;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles request acks for op=subscribe, unsubscribe and auth. A failed subscribe is surfaced as a
 * {@link SubscriptionRejection}; everything else is logged.
 */
public class StatusHandler {

    private static final Logger log = LoggerFactory.getLogger(StatusHandler.class);
    /** Venue error text names the topic as "topic:tickers.X" or "[tickers.X]". */
    private static final Pattern TOPIC_IN_MESSAGE = Pattern.compile("(?:topic:|\\[)\\s*([A-Za-z0-9_.\\-]+)");

    private final Consumer<SubscriptionRejection> rejections;

    public StatusHandler(Consumer<SubscriptionRejection> rejections) {
        this.rejections = rejections;
    }

    public void handle(String op, JsonNode root) {
        boolean success = root.path("success").asBoolean(true);
        String retMsg = root.path("ret_msg").asText("");
        String reqId = root.path("req_id").asText("");
        String connId = root.path("conn_id").asText("");

        if (success) {
            log.debug("Request succeeded op={} req_id={} conn_id={}", op, reqId, connId);
            return;
        }
        switch (op) {
            case "subscribe" -> {
                List<String> topics = rejectedTopics(root, retMsg);
                if (topics.isEmpty()) {
                    log.warn("Subscribe rejected (topic unknown): ret_msg={} req_id={}", retMsg, reqId);
                    rejections.accept(new SubscriptionRejection(null, retMsg, reqId));
                    return;
                }
                for (String topic : topics) {
                    log.warn("Subscribe rejected: topic={} ret_msg={} req_id={}", topic, retMsg, reqId);
                    rejections.accept(new SubscriptionRejection(topic, retMsg, reqId));
                }
            }
            case "unsubscribe" -> log.warn("Unsubscribe rejected: ret_msg={} req_id={}", retMsg, reqId);
            case "auth" -> log.error("Authentication rejected after handshake: ret_msg={}", retMsg);
            default -> log.debug("Request failed op={} ret_msg={}", op, retMsg);
        }
    }

    private static List<String> rejectedTopics(JsonNode root, String retMsg) {
        List<String> topics = new ArrayList<>();
        JsonNode args = root.path("args");
        if (args.isArray()) {
            for (JsonNode arg : args) {
                if (arg.isTextual() && !arg.asText().isBlank()) {
                    topics.add(arg.asText());
                }
            }
        }
        if (topics.isEmpty() && retMsg != null) {
            Matcher m = TOPIC_IN_MESSAGE.matcher(retMsg);
            while (m.find()) {
                topics.add(m.group(1));
            }
        }
        return topics;
    }
}
