package com.netbet.bybit.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.subscription.JsonFields;

import java.math.BigDecimal;

/** A fill (or funding/settlement execution) reported on the {@code execution} topic. */
public record ExecutionUpdate(
        String orderId,
        String symbol,
        String side,
        BigDecimal execPrice,
        BigDecimal execQty,
        BigDecimal execFee,
        long execTime,
        String execType,
        JsonNode raw
) {
    public static ExecutionUpdate from(JsonNode item) {
        return new ExecutionUpdate(
                JsonFields.text(item, "orderId"),
                JsonFields.text(item, "symbol"),
                JsonFields.text(item, "side"),
                JsonFields.decimal(item, "execPrice"),
                JsonFields.decimal(item, "execQty"),
                JsonFields.decimal(item, "execFee"),
                JsonFields.longValue(item, "execTime", -1),
                JsonFields.text(item, "execType"),
                item);
    }
}
