package com.netbet.bybit.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds Bybit V5 stream request messages.
 */
public final class StreamMessages {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StreamMessages() {}

    public static String subscribe(String topic) {
        return topicRequest("subscribe", topic);
    }

    public static String unsubscribe(String topic) {
        return topicRequest("unsubscribe", topic);
    }

    public static String ping(String reqId) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("op", "ping");
        root.put("req_id", reqId);
        return root.toString();
    }

    /** Private channel login: args are [apiKey, expires, signature]. */
    public static String authentication(String reqId, String apiKey, long expires, String signature) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("req_id", reqId);
        root.put("op", "auth");
        root.putArray("args").add(apiKey).add(expires).add(signature);
        return root.toString();
    }

    private static String topicRequest(String op, String topic) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("op", op);
        root.putArray("args").add(topic);
        return root.toString();
    }
}
