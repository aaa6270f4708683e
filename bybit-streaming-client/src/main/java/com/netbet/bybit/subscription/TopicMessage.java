package com.netbet.bybit.subscription;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One data frame as delivered to a {@link TopicHandler}.
 *
 * @param topic      topic the frame was published on
 * @param type       frame type (snapshot, delta) or null when the venue sends none
 * @param data       payload node (object or array)
 * @param ts         venue timestamp in epoch millis, or -1 if absent
 * @param receivedAt local receive time in epoch millis
 */
public record TopicMessage(
        String topic,
        String type,
        JsonNode data,
        long ts,
        long receivedAt
) {
    public boolean isDelta() {
        return "delta".equals(type);
    }
}
