package com.netbet.bybit.controller;

import com.netbet.bybit.orders.OrderManager;
import com.netbet.bybit.trading.OrderRequest;
import com.netbet.bybit.trading.TradingResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin endpoints for spot orders. Venue rejections come back as 400 with the venue's message.
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderManager orderManager;

    public OrderController(OrderManager orderManager) {
        this.orderManager = orderManager;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> place(@RequestBody OrderRequest order) {
        return toResponse(orderManager.placeSpotOrder(order, true));
    }

    @DeleteMapping("/{symbol}/{orderId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String symbol, @PathVariable String orderId) {
        return toResponse(orderManager.cancelSpotOrder(symbol, orderId, true));
    }

    @GetMapping("/history")
    public List<Map<String, Object>> history(@RequestParam(required = false) String symbol,
                                             @RequestParam(defaultValue = "100") int limit) {
        return orderManager.orderHistory(symbol, limit);
    }

    @GetMapping("/active")
    public List<Map<String, Object>> active() {
        return orderManager.activeOrders();
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync() {
        return ResponseEntity.ok(Map.of("synced", orderManager.syncOrdersWithExchange()));
    }

    @GetMapping("/balance")
    public ResponseEntity<Map<String, Object>> balance(@RequestParam(required = false) String coin) {
        return toResponse(orderManager.spotBalance(coin));
    }

    private static ResponseEntity<Map<String, Object>> toResponse(TradingResult result) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", result.success());
        if (result.success()) {
            body.put("result", result.result());
        } else {
            body.put("error", result.error());
        }
        return result.success() ? ResponseEntity.ok(body) : ResponseEntity.badRequest().body(body);
    }
}
