package com.netbet.bybit.controller;

import com.netbet.bybit.stream.ConnectionSession;
import com.netbet.bybit.subscription.Subscription;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only view of both stream sessions: state, registry entries and router counters.
 */
@RestController
@RequestMapping("/session")
public class SessionController {

    private final Map<String, ConnectionSession> sessions;

    public SessionController(@Qualifier("publicSession") ConnectionSession publicSession,
                             @Qualifier("privateSession") ConnectionSession privateSession) {
        this.sessions = Map.of(publicSession.name(), publicSession, privateSession.name(), privateSession);
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> summary() {
        Map<String, Object> result = new LinkedHashMap<>();
        sessions.forEach((name, s) -> result.put(name, Map.of(
                "state", s.state().name(),
                "subscriptions", s.subscriptions().stream().filter(Subscription::isActive).count())));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{name}")
    public ResponseEntity<Map<String, Object>> session(@PathVariable String name) {
        ConnectionSession s = sessions.get(name);
        if (s == null) {
            return ResponseEntity.notFound().build();
        }
        var stats = s.routerStats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", s.name());
        result.put("state", s.state().name());
        result.put("dispatched", stats.dispatched());
        result.put("dropped", stats.dropped());
        result.put("malformed", stats.malformed());
        result.put("handlerFailures", stats.handlerFailures());
        result.put("subscriptions", describe(s.subscriptions()));
        return ResponseEntity.ok(result);
    }

    private static List<Map<String, Object>> describe(List<Subscription> subscriptions) {
        return subscriptions.stream()
                .map(sub -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("topic", sub.topic());
                    m.put("active", sub.isActive());
                    m.put("deliveries", sub.deliveries());
                    m.put("lastDeliveryAt", sub.lastDeliveryAt());
                    return m;
                })
                .collect(Collectors.toList());
    }
}
