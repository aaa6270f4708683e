package com.netbet.bybit.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.resilience.HeartbeatScheduler;
import com.netbet.bybit.subscription.SubscriptionRegistry;
import com.netbet.bybit.subscription.TopicMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageRouterTest {

    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final HeartbeatScheduler heartbeat = new HeartbeatScheduler("r", Duration.ofSeconds(20), Duration.ofSeconds(40));
    private final List<SubscriptionRejection> rejections = new ArrayList<>();
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        router = new MessageRouter(new ObjectMapper(), registry,
                new HeartbeatHandler(heartbeat), new StatusHandler(rejections::add));
    }

    @Test
    void dispatchesDataFrameToActiveHandler() {
        List<TopicMessage> received = new ArrayList<>();
        registry.upsert("tickers.BTCUSDT", received::add);

        router.route("{\"topic\":\"tickers.BTCUSDT\",\"type\":\"delta\",\"ts\":1700000000123,"
                + "\"data\":{\"lastPrice\":\"65000.5\"}}", 99L);

        assertThat(received).singleElement().satisfies(m -> {
            assertThat(m.topic()).isEqualTo("tickers.BTCUSDT");
            assertThat(m.isDelta()).isTrue();
            assertThat(m.ts()).isEqualTo(1700000000123L);
            assertThat(m.receivedAt()).isEqualTo(99L);
            assertThat(m.data().path("lastPrice").asText()).isEqualTo("65000.5");
        });
        assertThat(registry.findActive("tickers.BTCUSDT").deliveries()).isEqualTo(1);
        assertThat(router.stats().dispatched()).isEqualTo(1);
    }

    @Test
    void missingTimestampIsMinusOne() {
        List<TopicMessage> received = new ArrayList<>();
        registry.upsert("order", received::add);

        router.route("{\"topic\":\"order\",\"data\":[]}", 5L);

        assertThat(received.get(0).ts()).isEqualTo(-1L);
        assertThat(received.get(0).type()).isNull();
    }

    @Test
    void dropsFramesForUnknownOrInactiveTopics() {
        List<TopicMessage> received = new ArrayList<>();
        registry.upsert("a", received::add);
        registry.deactivate("a");

        router.route("{\"topic\":\"a\",\"data\":{}}", 1L);
        router.route("{\"topic\":\"b\",\"data\":{}}", 1L);

        assertThat(received).isEmpty();
        assertThat(router.stats().dropped()).isEqualTo(2);
    }

    @Test
    void handlerExceptionIsContained() {
        registry.upsert("a", m -> { throw new IllegalStateException("boom"); });

        router.route("{\"topic\":\"a\",\"data\":{}}", 1L);

        assertThat(router.stats().handlerFailures()).isEqualTo(1);
        assertThat(router.stats().dispatched()).isZero();
        assertThat(registry.findActive("a").deliveries()).isZero();
    }

    @Test
    void handlerErrorIsContained() {
        List<TopicMessage> received = new ArrayList<>();
        registry.upsert("a", m -> { throw new AssertionError("handler bug"); });
        registry.upsert("b", received::add);

        router.route("{\"topic\":\"a\",\"data\":{}}", 1L);
        router.route("{\"topic\":\"b\",\"data\":{}}", 2L);

        assertThat(router.stats().handlerFailures()).isEqualTo(1);
        assertThat(received).hasSize(1);
    }

    @Test
    void malformedAndNonObjectFramesAreCounted() {
        router.route("{oops", 1L);
        router.route("[1,2,3]", 1L);
        router.route("", 1L);

        assertThat(router.stats().malformed()).isEqualTo(2);
    }

    @Test
    void pongAndSpotPingRepliesFeedHeartbeat() {
        router.route("{\"op\":\"pong\",\"req_id\":\"r-1\",\"args\":[\"1700\"]}", 1L);
        assertThat(heartbeat.lastAckRequestId()).isEqualTo("r-1");

        router.route("{\"success\":true,\"ret_msg\":\"pong\",\"conn_id\":\"c\",\"req_id\":\"r-2\",\"op\":\"ping\"}", 1L);
        assertThat(heartbeat.lastAckRequestId()).isEqualTo("r-2");
    }

    @Test
    void subscribeNackTakesTopicFromArgs() {
        router.route("{\"success\":false,\"ret_msg\":\"Invalid topic\",\"op\":\"subscribe\",\"req_id\":\"9\","
                + "\"args\":[\"tickers.NOPE\"]}", 1L);

        assertThat(rejections).containsExactly(new SubscriptionRejection("tickers.NOPE", "Invalid topic", "9"));
    }

    @Test
    void subscribeNackTakesTopicFromBracketedMessage() {
        router.route("{\"success\":false,\"ret_msg\":\"Invalid symbol :[tickers.NOPE]\",\"op\":\"subscribe\"}", 1L);

        assertThat(rejections).extracting(SubscriptionRejection::topic).containsExactly("tickers.NOPE");
    }

    @Test
    void subscribeNackWithoutTopicReportsNull() {
        router.route("{\"success\":false,\"ret_msg\":\"too many requests\",\"op\":\"subscribe\"}", 1L);

        assertThat(rejections).singleElement().satisfies(r -> {
            assertThat(r.topic()).isNull();
            assertThat(r.reason()).isEqualTo("too many requests");
        });
    }

    @Test
    void successfulAcksProduceNoRejection() {
        router.route("{\"success\":true,\"ret_msg\":\"\",\"op\":\"subscribe\",\"conn_id\":\"c\"}", 1L);
        router.route("{\"success\":false,\"ret_msg\":\"x\",\"op\":\"unsubscribe\"}", 1L);

        assertThat(rejections).isEmpty();
    }
}
