package com.netbet.bybit.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.resilience.HeartbeatScheduler;

/**
 * Handles heartbeat acks (op=pong, or op=ping with ret_msg=pong on spot). Feeds liveness bookkeeping.
 */
public class HeartbeatHandler {

    private final HeartbeatScheduler heartbeat;

    public HeartbeatHandler(HeartbeatScheduler heartbeat) {
        this.heartbeat = heartbeat;
    }

    public void handle(JsonNode root) {
        heartbeat.recordAck(root.path("req_id").asText(null));
    }
}
