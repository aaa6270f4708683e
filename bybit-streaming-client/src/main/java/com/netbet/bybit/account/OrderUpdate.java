package com.netbet.bybit.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.subscription.JsonFields;

import java.math.BigDecimal;

/** One element of an {@code order} topic message. */
public record OrderUpdate(
        String orderId,
        String symbol,
        String side,
        BigDecimal price,
        BigDecimal qty,
        String status,
        String orderType,
        long updatedTime,
        JsonNode raw
) {
    public static OrderUpdate from(JsonNode item) {
        return new OrderUpdate(
                JsonFields.text(item, "orderId"),
                JsonFields.text(item, "symbol"),
                JsonFields.text(item, "side"),
                JsonFields.decimal(item, "price"),
                JsonFields.decimal(item, "qty"),
                JsonFields.text(item, "orderStatus"),
                JsonFields.text(item, "orderType"),
                JsonFields.longValue(item, "updatedTime", -1),
                item);
    }
}
