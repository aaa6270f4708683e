package com.netbet.bybit.orders;

import com.fasterxml.jackson.databind.JsonNode;
import com.netbet.bybit.account.AccountStream;
import com.netbet.bybit.account.OrderUpdate;
import com.netbet.bybit.persistence.RecordStore;
import com.netbet.bybit.trading.OrderRequest;
import com.netbet.bybit.trading.TradingClient;
import com.netbet.bybit.trading.TradingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Spot order lifecycle: place/cancel through {@link TradingClient}, record every order in the
 * orders table, and keep its status current from the private {@code order} stream.
 * Nothing is written before {@link #setupDatabase} succeeded. Stream-driven status writes run on a
 * single bounded worker so the private session's receive thread never waits on the database.
 */
@Component
public class OrderManager {

    private static final Logger log = LoggerFactory.getLogger(OrderManager.class);

    public static final List<String> DEFAULT_COLUMNS = List.of(
            "id SERIAL PRIMARY KEY",
            "order_id VARCHAR(64) UNIQUE NOT NULL",
            "symbol VARCHAR(32) NOT NULL",
            "side VARCHAR(8) NOT NULL",
            "order_type VARCHAR(16) NOT NULL",
            "quantity NUMERIC(36, 18)",
            "price NUMERIC(36, 18)",
            "status VARCHAR(32)",
            "category VARCHAR(16)",
            "timestamp TIMESTAMP DEFAULT CURRENT_TIMESTAMP"
    );
    static final List<String> ACTIVE_STATUSES = List.of("New", "PartiallyFilled");

    private final TradingClient tradingClient;
    private final RecordStore store;
    private final AccountStream accountStream;
    private final String configuredTable;

    private final ThreadPoolExecutor statusWriter;
    private final AtomicLong droppedStatusWrites = new AtomicLong();

    private volatile String tableName;

    public OrderManager(TradingClient tradingClient,
                        RecordStore store,
                        AccountStream accountStream,
                        @Value("${bybit.orders.table:spot_orders}") String configuredTable,
                        @Value("${bybit.orders.status-queue-capacity:10000}") int statusQueueCapacity) {
        this.tradingClient = tradingClient;
        this.store = store;
        this.accountStream = accountStream;
        this.configuredTable = configuredTable;
        this.statusWriter = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(statusQueueCapacity > 0 ? statusQueueCapacity : 10_000),
                r -> {
                    Thread t = new Thread(r, "order-status-writer");
                    t.setDaemon(true);
                    return t;
                },
                (task, executor) -> {
                    droppedStatusWrites.incrementAndGet();
                    log.warn("Order status queue full or closed; dropping status write");
                });
    }

    public boolean setupDatabase() {
        return setupDatabase(configuredTable, DEFAULT_COLUMNS);
    }

    public boolean setupDatabase(String table, List<String> columns) {
        boolean ok = store.createCollection(table, columns);
        if (ok) {
            tableName = table;
            log.info("Order table '{}' ready", table);
        }
        return ok;
    }

    /**
     * Subscribe to order updates on the private session; each update writes its status to the table.
     * The subscription is sent once the private session is connected.
     */
    public boolean startOrderTracking(Consumer<OrderUpdate> customHandler) {
        String table = tableName;
        if (table == null) {
            log.error("Order table not set up; call setupDatabase first");
            return false;
        }
        accountStream.subscribeOrders(update -> {
            if (update.orderId() != null && update.status() != null) {
                statusWriter.execute(() -> writeStatus(table, update.orderId(), update.status()));
            }
            if (customHandler != null) {
                customHandler.accept(update);
            }
        });
        log.info("Real-time order tracking started");
        return true;
    }

    public TradingResult placeSpotOrder(OrderRequest order, boolean saveToDb) {
        TradingResult result = tradingClient.placeSpotOrder(order);
        String table = tableName;
        if (saveToDb && result.success() && table != null) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("order_id", result.orderId());
            row.put("symbol", order.symbol());
            row.put("side", order.side());
            row.put("order_type", order.orderType());
            row.put("quantity", decimalOrNull(order.qty()));
            row.put("price", decimalOrNull(order.price()));
            row.put("status", "New");
            row.put("category", "spot");
            if (store.insert(table, row)) {
                log.info("Spot order {} saved to {}", result.orderId(), table);
            }
        }
        return result;
    }

    public TradingResult cancelSpotOrder(String symbol, String orderId, boolean updateDb) {
        TradingResult result = tradingClient.cancelSpotOrder(symbol, orderId);
        String table = tableName;
        if (updateDb && result.success() && table != null) {
            store.update(table, Map.of("status", "Cancelled"), Map.of("order_id", orderId));
            log.info("Order {} marked as cancelled", orderId);
        }
        return result;
    }

    /** Latest orders first; {@code symbol} may be null for all symbols. */
    public List<Map<String, Object>> orderHistory(String symbol, int limit) {
        String table = tableName;
        if (table == null) {
            log.error("Order table not set up");
            return List.of();
        }
        Map<String, Object> predicate = new LinkedHashMap<>();
        if (symbol != null && !symbol.isBlank()) {
            predicate.put("symbol", symbol);
        }
        return store.selectLatest(table, predicate, "timestamp", limit);
    }

    public List<Map<String, Object>> activeOrders() {
        String table = tableName;
        if (table == null) {
            log.error("Order table not set up");
            return List.of();
        }
        return store.selectLatest(table, Map.of("status", ACTIVE_STATUSES), "timestamp", 0);
    }

    /** Copy the venue's status of every open order onto the table. Returns the number of rows updated. */
    public int syncOrdersWithExchange() {
        TradingResult result = tradingClient.getOpenOrders(null, null);
        if (!result.success()) {
            log.error("Failed to get orders from exchange: {}", result.error());
            return 0;
        }
        String table = tableName;
        int synced = 0;
        for (JsonNode order : result.list()) {
            String orderId = order.path("orderId").asText(null);
            String status = order.path("orderStatus").asText(null);
            if (orderId != null && status != null && table != null
                    && store.update(table, Map.of("status", status), Map.of("order_id", orderId)) > 0) {
                synced++;
            }
        }
        log.info("Synced {} orders with exchange", synced);
        return synced;
    }

    public TradingResult spotBalance(String coin) {
        return tradingClient.getSpotBalance(coin);
    }

    public TradingResult ticker(String symbol) {
        return tradingClient.getTicker(symbol);
    }

    public String tableName() {
        return tableName;
    }

    /** Telemetry: status writes rejected because the queue was full or the manager was shut down. */
    public long getDroppedStatusWrites() {
        return droppedStatusWrites.get();
    }

    @PreDestroy
    public void shutdown() {
        statusWriter.shutdown();
        try {
            if (!statusWriter.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Order status writer did not drain in time; {} write(s) abandoned",
                        statusWriter.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            statusWriter.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void writeStatus(String table, String orderId, String status) {
        log.info("Updating order {} to status '{}'", orderId, status);
        try {
            store.update(table, Map.of("status", status), Map.of("order_id", orderId));
        } catch (RuntimeException e) {
            log.error("Failed to update order {} to status '{}': {}", orderId, status, e.getMessage(), e);
        }
    }

    private static BigDecimal decimalOrNull(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Not a decimal: {}", value);
            return null;
        }
    }
}
