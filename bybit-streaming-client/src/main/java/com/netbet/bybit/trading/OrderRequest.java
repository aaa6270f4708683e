package com.netbet.bybit.trading;

/**
 * Spot order parameters as the venue expects them: side {@code Buy}/{@code Sell}, type
 * {@code Limit}/{@code Market}, quantity and price as decimal strings.
 */
public record OrderRequest(String symbol, String side, String orderType, String qty, String price) {

    public static OrderRequest limit(String symbol, String side, String qty, String price) {
        return new OrderRequest(symbol, side, "Limit", qty, price);
    }

    public static OrderRequest market(String symbol, String side, String qty) {
        return new OrderRequest(symbol, side, "Market", qty, null);
    }

    public boolean isLimit() {
        return "LIMIT".equalsIgnoreCase(orderType);
    }
}
