package com.netbet.bybit.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.stream.ConnectionSession;
import com.netbet.bybit.subscription.Subscription;
import com.netbet.bybit.subscription.TopicHandler;
import com.netbet.bybit.subscription.Topics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Typed views over the private session's account topics. Each message's {@code data} array is
 * unpacked and every element passed to the consumer separately.
 */
@Component
public class AccountStream {

    private final ConnectionSession session;

    public AccountStream(@Qualifier("privateSession") ConnectionSession session) {
        this.session = session;
    }

    public void subscribeOrders(Consumer<OrderUpdate> consumer) {
        subscribeTyped(Topics.ORDER, OrderUpdate::from, consumer);
    }

    public void subscribePositions(Consumer<PositionUpdate> consumer) {
        subscribeTyped(Topics.POSITION, PositionUpdate::from, consumer);
    }

    public void subscribeExecutions(Consumer<ExecutionUpdate> consumer) {
        subscribeTyped(Topics.EXECUTION, ExecutionUpdate::from, consumer);
    }

    public void subscribeWallet(Consumer<WalletUpdate> consumer) {
        subscribeTyped(Topics.WALLET, WalletUpdate::from, consumer);
    }

    /** Raw messages, e.g. for category-specific topics such as {@code order.spot}. */
    public void subscribeCustom(String topic, TopicHandler handler) {
        session.subscribe(topic, handler);
    }

    public boolean unsubscribe(String topic) {
        return session.unsubscribe(topic);
    }

    public List<String> subscriptions() {
        return session.subscriptions().stream()
                .filter(Subscription::isActive)
                .map(Subscription::topic)
                .toList();
    }

    public ConnectionSession session() {
        return session;
    }

    private <T> void subscribeTyped(String topic, Function<JsonNode, T> mapper, Consumer<T> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        session.subscribe(topic, message -> {
            JsonNode data = message.data();
            if (data == null) {
                return;
            }
            if (data.isArray()) {
                for (JsonNode item : data) {
                    consumer.accept(mapper.apply(item));
                }
            } else if (data.isObject()) {
                consumer.accept(mapper.apply(data));
            }
        });
    }
}
