package com.netbet.bybit.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.router.SubscriptionRejection;
import com.netbet.bybit.subscription.TopicMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionSessionTest {

    private static final String BTC = "tickers.BTCUSDT";
    private static final String ETH = "tickers.ETHUSDT";

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeTransportFactory factory;
    private ConnectionSession session;
    private final List<String> transitions = new CopyOnWriteArrayList<>();
    private final List<SubscriptionRejection> rejections = new CopyOnWriteArrayList<>();
    private final List<ConnectionException> failures = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        factory = new FakeTransportFactory();
        session = newSession(quietSettings(), SessionAuthenticator.NONE);
    }

    @AfterEach
    void tearDown() {
        factory.openGate();
        session.close();
    }

    @Test
    void subscribeBeforeConnectSendsExactlyOneSubscribeAfterConnect() throws Exception {
        session.subscribe(BTC, m -> { });
        assertThat(factory.createdCount()).isZero();

        session.connect();

        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
        assertThat(factory.transport(0).sentSubscribes()).containsExactly(StreamMessages.subscribe(BTC));
    }

    @Test
    void resubscribingActiveTopicReplacesHandlerWithoutSecondRequest() throws Exception {
        session.connect();
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        session.subscribe(BTC, m -> first.incrementAndGet());
        session.subscribe(BTC, m -> second.incrementAndGet());
        factory.transport(0).deliver(tickerFrame(BTC, "100"));

        Await.until(() -> second.get() == 1);
        assertThat(first.get()).isZero();
        assertThat(factory.transport(0).countSent(StreamMessages.subscribe(BTC))).isEqualTo(1);
        assertThat(session.subscriptions()).hasSize(1);
    }

    @Test
    void transportDropReconnectsAndReplaysSubscriptionOnce() throws Exception {
        session.subscribe(BTC, m -> { });
        session.connect();
        assertThat(session.heartbeat().isRunning()).isTrue();

        factory.closeGate();
        factory.transport(0).drop();

        Await.until(() -> factory.connectCalls() == 2);
        assertThat(session.state()).isEqualTo(SessionState.RECONNECTING);
        assertThat(session.heartbeat().isRunning()).isFalse();
        assertThat(factory.transport(0).isClosed()).isTrue();
        assertThat(session.isSubscribed(BTC)).isTrue();

        factory.openGate();
        Await.until(() -> session.state() == SessionState.CONNECTED);

        assertThat(factory.createdCount()).isEqualTo(2);
        assertThat(factory.transport(1).sentSubscribes()).containsExactly(StreamMessages.subscribe(BTC));
        assertThat(session.heartbeat().isRunning()).isTrue();
        assertThat(transitions).containsSubsequence("CONNECTED->RECONNECTING", "RECONNECTING->CONNECTED");
    }

    @Test
    void replayFollowsInsertionOrderAndSkipsInactiveTopics() throws Exception {
        session.subscribe("a", m -> { });
        session.subscribe("b", m -> { });
        session.subscribe("c", m -> { });
        assertThat(session.unsubscribe("b")).isTrue();

        session.connect();
        assertThat(factory.transport(0).sentSubscribes())
                .containsExactly(StreamMessages.subscribe("a"), StreamMessages.subscribe("c"));

        session.unsubscribe("a");
        session.subscribe("b", m -> { });
        factory.transport(0).drop();
        Await.until(() -> factory.createdCount() == 2 && session.state() == SessionState.CONNECTED);

        assertThat(factory.transport(1).sentSubscribes())
                .containsExactly(StreamMessages.subscribe("b"), StreamMessages.subscribe("c"));
    }

    @Test
    void connectRetriesWithBackoffThenSucceeds() throws Exception {
        factory.failNext(2);

        session.connect();

        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
        assertThat(factory.createdCount()).isEqualTo(3);
        assertThat(factory.transport(0).isClosed()).isTrue();
        assertThat(factory.transport(1).isClosed()).isTrue();
    }

    @Test
    void connectGivesUpAfterMaxAttemptsAndKeepsRegistry() {
        session.subscribe(BTC, m -> { });
        factory.failAll(true);

        assertThatThrownBy(() -> session.connect())
                .isInstanceOf(ConnectionException.class)
                .hasCauseInstanceOf(IOException.class);

        assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(factory.createdCount()).isEqualTo(3);
        assertThat(session.isSubscribed(BTC)).isTrue();
    }

    @Test
    void connectWhileConnectedIsNoOp() throws Exception {
        session.connect();
        session.connect();

        assertThat(factory.createdCount()).isEqualTo(1);
    }

    @Test
    void staleConnectionMovesToReconnecting() throws Exception {
        session.close();
        SessionSettings fast = new SessionSettings(Duration.ofMillis(100), 2.0, Duration.ofSeconds(1),
                Duration.ofMillis(50), Duration.ofMillis(10), Duration.ofMillis(50), 3);
        session = newSession(fast, SessionAuthenticator.NONE);
        session.subscribe(BTC, m -> { });

        session.connect();

        Await.until(() -> transitions.contains("CONNECTED->RECONNECTING"));
        Await.until(() -> factory.createdCount() >= 2);
        assertThat(factory.transport(0).isClosed()).isTrue();
        assertThat(factory.transport(0).sent()).anyMatch(s -> s.contains("\"op\":\"ping\""));
    }

    @Test
    void inboundTrafficKeepsConnectionAlive() throws Exception {
        session.close();
        SessionSettings fast = new SessionSettings(Duration.ofMillis(100), 3.0, Duration.ofSeconds(1),
                Duration.ofMillis(20), Duration.ofMillis(10), Duration.ofMillis(50), 3);
        session = newSession(fast, SessionAuthenticator.NONE);
        session.connect();

        FakeTransport t = factory.transport(0);
        long until = System.currentTimeMillis() + 700;
        while (System.currentTimeMillis() < until) {
            t.deliver("{\"op\":\"pong\",\"req_id\":\"x\"}");
            Thread.sleep(50);
        }

        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
        assertThat(factory.createdCount()).isEqualTo(1);
    }

    @Test
    void unsubscribedTopicIsNotDelivered() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        session.subscribe(BTC, m -> calls.incrementAndGet());
        session.connect();

        assertThat(session.unsubscribe(BTC)).isTrue();
        factory.transport(0).deliver(tickerFrame(BTC, "1"));

        Await.until(() -> session.routerStats().dropped() == 1);
        assertThat(calls.get()).isZero();
        assertThat(factory.transport(0).countSent(StreamMessages.unsubscribe(BTC))).isEqualTo(1);
        assertThat(session.unsubscribe(BTC)).isFalse();
        assertThat(session.unsubscribe("never.subscribed")).isFalse();
    }

    @Test
    void failingHandlerDoesNotAffectOtherTopicsOrSession() throws Exception {
        List<TopicMessage> eth = new CopyOnWriteArrayList<>();
        session.subscribe(BTC, m -> { throw new IllegalStateException("boom"); });
        session.subscribe(ETH, eth::add);
        session.connect();

        factory.transport(0).deliver(tickerFrame(BTC, "1"));
        factory.transport(0).deliver(tickerFrame(ETH, "2"));
        factory.transport(0).deliver(tickerFrame(BTC, "3"));
        factory.transport(0).deliver(tickerFrame(ETH, "4"));

        Await.until(() -> eth.size() == 2);
        Await.until(() -> session.routerStats().handlerFailures() == 2);
        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
        assertThat(eth.get(0).data().path("lastPrice").asText()).isEqualTo("2");
        assertThat(eth.get(1).data().path("lastPrice").asText()).isEqualTo("4");
    }

    @Test
    void malformedFrameIsCountedAndIgnored() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        session.subscribe(BTC, m -> calls.incrementAndGet());
        session.connect();

        factory.transport(0).deliver("{not json");
        factory.transport(0).deliver(tickerFrame(BTC, "1"));

        Await.until(() -> calls.get() == 1);
        assertThat(session.routerStats().malformed()).isEqualTo(1);
        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
    }

    @Test
    void subscribeNackIsReportedAndEntryStaysActive() throws Exception {
        session.subscribe("tickers.FOO", m -> { });
        session.connect();

        factory.transport(0).deliver("{\"success\":false,\"ret_msg\":\"error:handler not found,topic:tickers.FOO\","
                + "\"conn_id\":\"c1\",\"req_id\":\"\",\"op\":\"subscribe\"}");

        Await.until(() -> rejections.size() == 1);
        assertThat(rejections.get(0).topic()).isEqualTo("tickers.FOO");
        assertThat(rejections.get(0).reason()).contains("handler not found");
        assertThat(session.isSubscribed("tickers.FOO")).isTrue();
    }

    @Test
    void closeIsIdempotentAndTerminal() throws Exception {
        session.subscribe(BTC, m -> { });
        session.connect();

        session.close();
        session.close();

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        assertThat(factory.transport(0).isClosed()).isTrue();
        assertThat(session.heartbeat().isRunning()).isFalse();
        assertThat(transitions).containsSubsequence("CONNECTED->CLOSING", "CLOSING->CLOSED");
        assertThatThrownBy(() -> session.subscribe(ETH, m -> { })).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.connect()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeDuringReconnectBackoffStopsRetrying() throws Exception {
        session.close();
        SessionSettings slow = new SessionSettings(Duration.ofSeconds(5), 2.0, Duration.ofSeconds(1),
                Duration.ofMillis(50), Duration.ofSeconds(10), Duration.ofSeconds(10), 5);
        session = newSession(slow, SessionAuthenticator.NONE);
        session.connect();

        factory.failAll(true);
        factory.transport(0).drop();
        Await.until(() -> factory.createdCount() == 2);

        session.close();

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        Thread.sleep(100);
        assertThat(factory.createdCount()).isEqualTo(2);
    }

    @Test
    void backgroundReconnectExhaustionNotifiesListeners() throws Exception {
        session.connect();
        factory.failAll(true);

        factory.transport(0).drop();

        Await.until(() -> failures.size() == 1);
        assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(session.heartbeat().isRunning()).isFalse();
    }

    @Test
    void authenticationFailureCountsAsFailedAttempt() throws Exception {
        session.close();
        AtomicInteger calls = new AtomicInteger();
        session = newSession(quietSettings(), (transport, timeout) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("auth rejected");
            }
        });

        session.connect();

        assertThat(calls.get()).isEqualTo(2);
        assertThat(factory.createdCount()).isEqualTo(2);
        assertThat(factory.transport(0).isClosed()).isTrue();
        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
    }

    @Test
    void unexpectedFailureDuringConnectCountsAsFailedAttempt() throws Exception {
        factory.throwOnNextCreate(new IllegalArgumentException("bad uri"));

        session.connect();

        assertThat(factory.createCalls()).isEqualTo(2);
        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
    }

    @Test
    void connectThatAlwaysThrowsEndsDisconnectedAndCanBeRetried() throws Exception {
        factory.throwOnCreate(new IllegalStateException("transport is single-use"));

        assertThatThrownBy(() -> session.connect())
                .isInstanceOf(ConnectionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(factory.createCalls()).isEqualTo(3);

        factory.throwOnCreate(null);
        session.connect();

        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
    }

    @Test
    void backgroundReconnectThatThrowsNotifiesListenersAndCanBeRetried() throws Exception {
        session.subscribe(BTC, m -> { });
        session.connect();
        factory.throwOnCreate(new IllegalArgumentException("bad uri"));

        factory.transport(0).drop();

        Await.until(() -> failures.size() == 1);
        assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(failures.get(0)).hasRootCauseInstanceOf(IllegalArgumentException.class);

        factory.throwOnCreate(null);
        session.connect();

        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
        assertThat(factory.last().sentSubscribes()).containsExactly(StreamMessages.subscribe(BTC));
    }

    @Test
    void handlerErrorDoesNotStopDeliveryToOtherTopics() throws Exception {
        List<TopicMessage> eth = new CopyOnWriteArrayList<>();
        session.subscribe(BTC, m -> { throw new AssertionError("handler bug"); });
        session.subscribe(ETH, eth::add);
        session.connect();

        factory.transport(0).deliver(tickerFrame(BTC, "1"));
        factory.transport(0).deliver(tickerFrame(ETH, "2"));

        Await.until(() -> eth.size() == 1);
        assertThat(session.routerStats().handlerFailures()).isEqualTo(1);
        assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
        assertThat(factory.createdCount()).isEqualTo(1);
    }

    @Test
    void noHandlerRunsOnceClosingHasBegun() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        session.subscribe(BTC, m -> calls.incrementAndGet());
        session.connect();
        FakeTransport t = factory.transport(0);
        t.deliver(tickerFrame(BTC, "1"));
        Await.until(() -> calls.get() == 1);

        session.addListener(new SessionListener() {
            @Override
            public void onStateChanged(SessionState previous, SessionState current) {
                if (current == SessionState.CLOSING) {
                    t.deliver(tickerFrame(BTC, "2"));
                    t.deliver(tickerFrame(BTC, "3"));
                }
            }
        });
        session.close();

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(session.routerStats().dispatched()).isEqualTo(1);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> session.subscribe(" ", m -> { })).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.subscribe(null, m -> { })).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.subscribe(BTC, null)).isInstanceOf(NullPointerException.class);
    }

    private ConnectionSession newSession(SessionSettings settings, SessionAuthenticator authenticator) {
        transitions.clear();
        ConnectionSession s = new ConnectionSession("test", factory, authenticator, mapper, settings);
        s.addListener(new SessionListener() {
            @Override
            public void onStateChanged(SessionState previous, SessionState current) {
                transitions.add(previous + "->" + current);
            }

            @Override
            public void onSubscriptionRejected(SubscriptionRejection rejection) {
                rejections.add(rejection);
            }

            @Override
            public void onConnectionFailed(ConnectionException error) {
                failures.add(error);
            }
        });
        return s;
    }

    private static SessionSettings quietSettings() {
        return new SessionSettings(Duration.ofSeconds(5), 2.0, Duration.ofSeconds(1),
                Duration.ofMillis(50), Duration.ofMillis(10), Duration.ofMillis(50), 3);
    }

    private static String tickerFrame(String topic, String lastPrice) {
        return "{\"topic\":\"" + topic + "\",\"type\":\"snapshot\",\"ts\":1700000000000,"
                + "\"data\":{\"symbol\":\"" + topic.substring(topic.indexOf('.') + 1) + "\",\"lastPrice\":\"" + lastPrice + "\"}}";
    }
}
