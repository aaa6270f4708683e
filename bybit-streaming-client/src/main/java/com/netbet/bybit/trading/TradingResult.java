package com.netbet.bybit.trading;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a REST trading call. Failures carry the venue's {@code retMsg} (or the local error)
 * instead of throwing.
 *
 * @param result the response's {@code result} object, or a missing node on failure
 */
public record TradingResult(boolean success, String error, JsonNode result) {

    public static TradingResult ok(JsonNode result) {
        return new TradingResult(true, null, result != null ? result : MissingNode.getInstance());
    }

    public static TradingResult failure(String error) {
        return new TradingResult(false, error, MissingNode.getInstance());
    }

    public String orderId() {
        return result.path("orderId").asText(null);
    }

    /** Elements of {@code result.list}, empty when absent. */
    public List<JsonNode> list() {
        List<JsonNode> items = new ArrayList<>();
        for (JsonNode n : result.path("list")) {
            items.add(n);
        }
        return items;
    }
}
