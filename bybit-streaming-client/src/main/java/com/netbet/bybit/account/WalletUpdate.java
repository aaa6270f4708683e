package com.netbet.bybit.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.subscription.JsonFields;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wallet snapshot for one account type.
 *
 * @param coins wallet balance per coin, in venue order
 */
public record WalletUpdate(
        String accountType,
        Map<String, BigDecimal> coins,
        long creationTime,
        JsonNode raw
) {
    public static WalletUpdate from(JsonNode item) {
        Map<String, BigDecimal> coins = new LinkedHashMap<>();
        for (JsonNode c : item.path("coin")) {
            String name = JsonFields.text(c, "coin");
            BigDecimal balance = JsonFields.decimal(c, "walletBalance");
            if (name != null && balance != null) {
                coins.put(name, balance);
            }
        }
        return new WalletUpdate(
                JsonFields.text(item, "accountType"),
                Collections.unmodifiableMap(coins),
                JsonFields.longValue(item, "creationTime", -1),
                item);
    }
}
