package com.netbet.bybit.trading;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netbet.bybit.auth.ApiCredentials;
import com.netbet.bybit.auth.BybitSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Signed Bybit V5 REST calls for spot trading. Every call returns a {@link TradingResult};
 * venue errors ({@code retCode != 0}), HTTP errors and I/O failures are logged and reported as failures.
 */
@Component
public class TradingClient {

    private static final Logger log = LoggerFactory.getLogger(TradingClient.class);
    private static final String CATEGORY = "spot";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final ApiCredentials credentials;
    private final BybitSigner signer;
    private final String baseUrl;
    private final long recvWindowMs;
    private final boolean testnet;
    private final Clock clock;

    public TradingClient(RestClient.Builder restClientBuilder,
                         ObjectMapper objectMapper,
                         ApiCredentials credentials,
                         BybitSigner signer,
                         @Value("${bybit.rest-url:https://api-testnet.bybit.com}") String baseUrl,
                         @Value("${bybit.recv-window-ms:5000}") long recvWindowMs,
                         @Value("${bybit.testnet:true}") boolean testnet,
                         Clock clock) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.credentials = credentials;
        this.signer = signer;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.recvWindowMs = recvWindowMs;
        this.testnet = testnet;
        this.clock = clock;
        log.info("Spot trading client initialized ({}) against {}", testnet ? "testnet" : "mainnet", this.baseUrl);
    }

    public TradingResult placeSpotOrder(OrderRequest order) {
        if (order.isLimit() && (order.price() == null || order.price().isBlank())) {
            log.error("Price is required for limit orders");
            return TradingResult.failure("Price is required for limit orders");
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("category", CATEGORY);
        body.put("symbol", order.symbol());
        body.put("side", order.side());
        body.put("orderType", order.orderType());
        body.put("qty", order.qty());
        if (order.isLimit()) {
            body.put("price", order.price());
        }
        log.info("Placing spot order: {}", body);
        TradingResult result = post("/v5/order/create", body, "placeSpotOrder");
        if (result.success()) {
            log.info("Spot order placed successfully. Order ID: {}", result.orderId());
        }
        return result;
    }

    public TradingResult cancelSpotOrder(String symbol, String orderId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("category", CATEGORY);
        body.put("symbol", symbol);
        body.put("orderId", orderId);
        log.info("Cancelling spot order {} for {}", orderId, symbol);
        TradingResult result = post("/v5/order/cancel", body, "cancelSpotOrder");
        if (result.success()) {
            log.info("Spot order {} cancelled", orderId);
        }
        return result;
    }

    /** Open spot orders, optionally filtered by symbol and/or order id. */
    public TradingResult getOpenOrders(String symbol, String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("category", CATEGORY);
        putIfPresent(params, "symbol", symbol);
        putIfPresent(params, "orderId", orderId);
        TradingResult result = get("/v5/order/realtime", params, "getOpenOrders");
        if (result.success()) {
            log.info("Retrieved {} open spot orders", result.list().size());
        }
        return result;
    }

    public TradingResult getOrderHistory(String symbol, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("category", CATEGORY);
        putIfPresent(params, "symbol", symbol);
        params.put("limit", String.valueOf(limit));
        TradingResult result = get("/v5/order/history", params, "getOrderHistory");
        if (result.success()) {
            log.info("Retrieved {} historical spot orders", result.list().size());
        }
        return result;
    }

    /**
     * Wallet balance; testnet accounts are UNIFIED, mainnet spot accounts SPOT.
     * On success the result is the first account entry (with {@code coin} and {@code totalEquity}).
     */
    public TradingResult getSpotBalance(String coin) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("accountType", testnet ? "UNIFIED" : "SPOT");
        putIfPresent(params, "coin", coin);
        TradingResult result = get("/v5/account/wallet-balance", params, "getSpotBalance");
        if (!result.success()) {
            return result;
        }
        JsonNode account = result.result().path("list").path(0);
        log.info("Retrieved balance for {} coins", account.path("coin").size());
        return TradingResult.ok(account.isMissingNode() ? objectMapper.createObjectNode() : account);
    }

    /** Current ticker; on success the result is the ticker object for the symbol. */
    public TradingResult getTicker(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("category", CATEGORY);
        params.put("symbol", symbol);
        TradingResult result = get("/v5/market/tickers", params, "getTicker");
        if (!result.success()) {
            return result;
        }
        JsonNode ticker = result.result().path("list").path(0);
        if (ticker.isMissingNode()) {
            return TradingResult.failure("No ticker data for " + symbol);
        }
        log.info("Ticker for {}: Price={}", symbol, ticker.path("lastPrice").asText(null));
        return TradingResult.ok(ticker);
    }

    private TradingResult post(String path, ObjectNode body, String operation) {
        String payload = body.toString();
        try {
            String response = restClient.post()
                    .uri(URI.create(baseUrl + path))
                    .headers(h -> signHeaders(payload).forEach(h::set))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
            return parse(response, operation);
        } catch (RestClientResponseException e) {
            log.warn("{} HTTP error: status={} body={}", operation, e.getStatusCode().value(), e.getResponseBodyAsString());
            return TradingResult.failure("HTTP " + e.getStatusCode().value());
        } catch (Exception e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            return TradingResult.failure(e.getMessage());
        }
    }

    private TradingResult get(String path, Map<String, String> params, String operation) {
        String query = queryString(params);
        try {
            String response = restClient.get()
                    .uri(URI.create(baseUrl + path + (query.isEmpty() ? "" : "?" + query)))
                    .headers(h -> signHeaders(query).forEach(h::set))
                    .retrieve()
                    .body(String.class);
            return parse(response, operation);
        } catch (RestClientResponseException e) {
            log.warn("{} HTTP error: status={} body={}", operation, e.getStatusCode().value(), e.getResponseBodyAsString());
            return TradingResult.failure("HTTP " + e.getStatusCode().value());
        } catch (Exception e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            return TradingResult.failure(e.getMessage());
        }
    }

    private TradingResult parse(String response, String operation) throws IOException {
        if (response == null || response.isBlank()) {
            log.warn("{} returned an empty body", operation);
            return TradingResult.failure("Empty response");
        }
        JsonNode root = objectMapper.readTree(response);
        int retCode = root.path("retCode").asInt(-1);
        if (retCode != 0) {
            String retMsg = root.path("retMsg").asText("Unknown error");
            log.error("{} rejected: retCode={} retMsg={}", operation, retCode, retMsg);
            return TradingResult.failure(retMsg);
        }
        return TradingResult.ok(root.path("result"));
    }

    private Map<String, String> signHeaders(String payload) {
        long timestamp = clock.millis();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-BAPI-API-KEY", credentials.apiKey());
        headers.put("X-BAPI-TIMESTAMP", String.valueOf(timestamp));
        headers.put("X-BAPI-RECV-WINDOW", String.valueOf(recvWindowMs));
        headers.put("X-BAPI-SIGN", signer.restSignature(timestamp, recvWindowMs, payload));
        return headers;
    }

    static String queryString(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((k, v) -> joiner.add(k + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isBlank()) {
            params.put(key, value);
        }
    }
}
