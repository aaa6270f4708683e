package com.netbet.bybit.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.subscription.JsonFields;

import java.math.BigDecimal;

public record PositionUpdate(
        String symbol,
        String side,
        BigDecimal size,
        BigDecimal entryPrice,
        BigDecimal markPrice,
        BigDecimal unrealisedPnl,
        BigDecimal positionIM,
        BigDecimal leverage,
        JsonNode raw
) {
    public static PositionUpdate from(JsonNode item) {
        return new PositionUpdate(
                JsonFields.text(item, "symbol"),
                JsonFields.text(item, "side"),
                JsonFields.decimal(item, "size"),
                JsonFields.decimal(item, "avgPrice", "entryPrice"),
                JsonFields.decimal(item, "markPrice"),
                JsonFields.decimal(item, "unrealisedPnl"),
                JsonFields.decimal(item, "positionIM"),
                JsonFields.decimal(item, "leverage"),
                item);
    }
}
