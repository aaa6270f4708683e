package com.netbet.bybit.subscription;

import java.util.Locale;

/**
 * Bybit V5 topic names. Symbols are upper-cased here; the registry itself matches topics exactly.
 */
public final class Topics {

    public static final String ORDER = "order";
    public static final String POSITION = "position";
    public static final String EXECUTION = "execution";
    public static final String WALLET = "wallet";

    private static final String TICKERS_PREFIX = "tickers.";

    private Topics() {}

    public static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must be non-null and non-blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static String ticker(String symbol) {
        return TICKERS_PREFIX + normalizeSymbol(symbol);
    }

    public static boolean isTicker(String topic) {
        return topic != null && topic.startsWith(TICKERS_PREFIX);
    }

    /** Symbol part of a ticker topic, or the topic itself if it is not a ticker topic. */
    public static String symbolOf(String topic) {
        return isTicker(topic) ? topic.substring(TICKERS_PREFIX.length()) : topic;
    }
}
