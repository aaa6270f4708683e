package com.netbet.bybit.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.subscription.JsonFields;
import com.netbet.bybit.subscription.TopicMessage;
import com.netbet.bybit.subscription.Topics;

import java.math.BigDecimal;

/**
 * Latest ticker values for one symbol. Any price field may be null when the venue omitted it
 * (deltas carry only changed fields).
 */
public record TickerData(
        String symbol,
        BigDecimal lastPrice,
        BigDecimal bidPrice,
        BigDecimal askPrice,
        BigDecimal high24h,
        BigDecimal low24h,
        BigDecimal volume24h,
        BigDecimal priceChange24h,
        long timestamp
) {

    public static TickerData fromMessage(TopicMessage message) {
        JsonNode data = message.data();
        String symbol = JsonFields.text(data, "symbol");
        if (symbol == null) {
            symbol = Topics.symbolOf(message.topic());
        }
        long ts = message.ts() > 0 ? message.ts() : message.receivedAt();
        return new TickerData(
                symbol,
                JsonFields.decimal(data, "lastPrice"),
                JsonFields.decimal(data, "bid1Price", "bidPrice"),
                JsonFields.decimal(data, "ask1Price", "askPrice"),
                JsonFields.decimal(data, "highPrice24h"),
                JsonFields.decimal(data, "lowPrice24h"),
                JsonFields.decimal(data, "volume24h"),
                JsonFields.decimal(data, "price24hPcnt"),
                ts);
    }

    /** Fields present in {@code update} win; missing ones keep this snapshot's values. */
    public TickerData merge(TickerData update) {
        return new TickerData(
                symbol,
                pick(update.lastPrice, lastPrice),
                pick(update.bidPrice, bidPrice),
                pick(update.askPrice, askPrice),
                pick(update.high24h, high24h),
                pick(update.low24h, low24h),
                pick(update.volume24h, volume24h),
                pick(update.priceChange24h, priceChange24h),
                Math.max(timestamp, update.timestamp));
    }

    private static BigDecimal pick(BigDecimal preferred, BigDecimal fallback) {
        return preferred != null ? preferred : fallback;
    }
}
