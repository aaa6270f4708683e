package com.netbet.bybit.controller;

import com.netbet.bybit.market.TickerCache;
import com.netbet.bybit.market.TickerStream;
import com.netbet.bybit.subscription.Topics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/tickers")
public class TickerController {

    private final TickerStream tickerStream;
    private final TickerCache tickerCache;

    public TickerController(TickerStream tickerStream, TickerCache tickerCache) {
        this.tickerStream = tickerStream;
        this.tickerCache = tickerCache;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> summary() {
        Map<String, Object> result = new HashMap<>();
        result.put("subscribed", tickerStream.subscribedSymbols());
        result.put("tickers", tickerCache.all());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<?> ticker(@PathVariable String symbol) {
        return tickerCache.get(Topics.normalizeSymbol(symbol))
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{symbol}")
    public ResponseEntity<Map<String, Object>> subscribe(@PathVariable String symbol) {
        String topic = tickerStream.subscribe(symbol);
        return ResponseEntity.ok(Map.of("topic", topic, "subscribed", true));
    }

    @DeleteMapping("/{symbol}")
    public ResponseEntity<Map<String, Object>> unsubscribe(@PathVariable String symbol) {
        boolean removed = tickerStream.unsubscribe(symbol);
        if (!removed) {
            return ResponseEntity.status(404).body(Map.of("symbol", symbol, "error", "not subscribed"));
        }
        return ResponseEntity.ok(Map.of("symbol", Topics.normalizeSymbol(symbol), "subscribed", false));
    }
}
