package com.netbet.bybit.market;

import com.netbet.bybit.stream.ConnectionSession;
import com.netbet.bybit.subscription.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Last-traded-price feed on the public session: one {@code tickers.<SYMBOL>} topic per symbol,
 * parsed into {@link TickerData} and kept in the {@link TickerCache}.
 */
@Component
public class TickerStream {

    private static final Logger log = LoggerFactory.getLogger(TickerStream.class);

    private final ConnectionSession session;
    private final TickerCache cache;

    public TickerStream(@Qualifier("publicSession") ConnectionSession session, TickerCache cache) {
        this.session = session;
        this.cache = cache;
    }

    public String subscribe(String symbol) {
        return subscribe(symbol, null);
    }

    /**
     * @param listener optional; called on the receive thread with the merged ticker after each update
     * @return the topic subscribed
     */
    public String subscribe(String symbol, Consumer<TickerData> listener) {
        String topic = Topics.ticker(symbol);
        session.subscribe(topic, message -> {
            TickerData merged = cache.apply(TickerData.fromMessage(message), message.isDelta());
            log.debug("{} last={} bid={} ask={}", merged.symbol(), merged.lastPrice(), merged.bidPrice(), merged.askPrice());
            if (listener != null) {
                listener.accept(merged);
            }
        });
        return topic;
    }

    public boolean unsubscribe(String symbol) {
        String normalized = Topics.normalizeSymbol(symbol);
        boolean removed = session.unsubscribe(Topics.ticker(normalized));
        if (removed) {
            cache.remove(normalized);
        }
        return removed;
    }

    public List<String> subscribedSymbols() {
        return session.subscriptions().stream()
                .filter(s -> s.isActive() && Topics.isTicker(s.topic()))
                .map(s -> Topics.symbolOf(s.topic()))
                .toList();
    }
}
