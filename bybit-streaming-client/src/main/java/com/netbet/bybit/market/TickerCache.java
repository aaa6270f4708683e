package com.netbet.bybit.market;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest ticker per symbol. Written from the public session's receive thread, read from anywhere.
 */
@Component
public class TickerCache {

    private final Map<String, TickerData> tickers = new ConcurrentHashMap<>();

    /**
     * Store a snapshot, or merge a delta onto the previous snapshot.
     *
     * @return the value now cached
     */
    public TickerData apply(TickerData ticker, boolean delta) {
        if (!delta) {
            tickers.put(ticker.symbol(), ticker);
            return ticker;
        }
        return tickers.merge(ticker.symbol(), ticker, TickerData::merge);
    }

    public Optional<TickerData> get(String symbol) {
        return Optional.ofNullable(tickers.get(symbol));
    }

    public Collection<TickerData> all() {
        return List.copyOf(tickers.values());
    }

    public void remove(String symbol) {
        tickers.remove(symbol);
    }

    public void clear() {
        tickers.clear();
    }

    public int size() {
        return tickers.size();
    }
}
