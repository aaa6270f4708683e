package com.netbet.bybit.auth;

/**
 * API key pair for the private stream and signed REST calls. Either value may be blank when the
 * application only consumes public market data.
 */
public record ApiCredentials(String apiKey, String apiSecret) {

    public ApiCredentials {
        apiKey = apiKey != null ? apiKey.trim() : "";
        apiSecret = apiSecret != null ? apiSecret.trim() : "";
    }

    public boolean isPresent() {
        return !apiKey.isEmpty() && !apiSecret.isEmpty();
    }

    @Override
    public String toString() {
        String masked = apiKey.length() > 4 ? apiKey.substring(0, 4) + "****" : "****";
        return "ApiCredentials[apiKey=" + masked + ", apiSecret=****]";
    }
}
