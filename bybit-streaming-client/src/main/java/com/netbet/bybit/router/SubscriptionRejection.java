package com.netbet.bybit.router;

/**
 * Venue refused a subscribe request. The registry entry stays active, so the topic is retried on the
 * next reconnect unless the caller unsubscribes.
 *
 * @param topic  rejected topic, or null when the venue message does not identify it
 * @param reason venue-provided reason text (ret_msg)
 * @param reqId  request id echoed by the venue, may be empty
 */
public record SubscriptionRejection(String topic, String reason, String reqId) {
}
