package com.netbet.bybit.runner;

import com.netbet.bybit.account.AccountStream;
import com.netbet.bybit.auth.ApiCredentials;
import com.netbet.bybit.market.TickerStream;
import com.netbet.bybit.orders.OrderManager;
import com.netbet.bybit.router.SubscriptionRejection;
import com.netbet.bybit.stream.ConnectionException;
import com.netbet.bybit.stream.ConnectionSession;
import com.netbet.bybit.stream.SessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Startup: register ticker subscriptions for the configured symbols, connect the public session
 * (subscriptions go out on connect), then optionally the private session with order tracking.
 * Reconnects are handled by the sessions themselves; this runner only reports when they give up.
 */
@Component
@ConditionalOnProperty(name = "bybit.runner.enabled", havingValue = "true", matchIfMissing = true)
public class StreamingRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StreamingRunner.class);

    private final ConnectionSession publicSession;
    private final ConnectionSession privateSession;
    private final TickerStream tickerStream;
    private final AccountStream accountStream;
    private final OrderManager orderManager;
    private final ApiCredentials credentials;
    private final String[] symbols;
    private final int streamDurationMinutes;
    private final boolean unsubscribeRejected;
    private final boolean privateStreamEnabled;
    private final boolean orderTrackingEnabled;

    public StreamingRunner(@Qualifier("publicSession") ConnectionSession publicSession,
                           @Qualifier("privateSession") ConnectionSession privateSession,
                           TickerStream tickerStream,
                           AccountStream accountStream,
                           OrderManager orderManager,
                           ApiCredentials credentials,
                           @Value("${bybit.symbols:BTCUSDT,ETHUSDT}") String[] symbols,
                           @Value("${bybit.stream-duration-minutes:0}") int streamDurationMinutes,
                           @Value("${bybit.unsubscribe-rejected:false}") boolean unsubscribeRejected,
                           @Value("${bybit.private-stream.enabled:false}") boolean privateStreamEnabled,
                           @Value("${bybit.orders.tracking-enabled:true}") boolean orderTrackingEnabled) {
        this.publicSession = publicSession;
        this.privateSession = privateSession;
        this.tickerStream = tickerStream;
        this.accountStream = accountStream;
        this.orderManager = orderManager;
        this.credentials = credentials;
        this.symbols = symbols;
        this.streamDurationMinutes = Math.max(0, streamDurationMinutes);
        this.unsubscribeRejected = unsubscribeRejected;
        this.privateStreamEnabled = privateStreamEnabled;
        this.orderTrackingEnabled = orderTrackingEnabled;
    }

    @Override
    public void run(String... args) {
        log.info("Starting Bybit stream client (symbols={}, private={}, duration={} min)",
                String.join(",", symbols), privateStreamEnabled,
                streamDurationMinutes > 0 ? streamDurationMinutes : "unlimited");

        publicSession.addListener(new RunnerListener(publicSession));
        for (String symbol : symbols) {
            if (symbol.isBlank()) continue;
            tickerStream.subscribe(symbol, t -> log.info("LTP {} = {}", t.symbol(), t.lastPrice()));
        }
        connect(publicSession);

        if (privateStreamEnabled) {
            startPrivate();
        }

        if (streamDurationMinutes > 0) {
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "stream-duration");
                t.setDaemon(true);
                return t;
            });
            scheduler.schedule(() -> {
                log.info("Stream duration ({} min) reached. Stopping...", streamDurationMinutes);
                publicSession.close();
                privateSession.close();
                scheduler.shutdown();
            }, streamDurationMinutes, TimeUnit.MINUTES);
        }
    }

    private void startPrivate() {
        if (!credentials.isPresent()) {
            log.warn("Private stream enabled but BYBIT_API_KEY/BYBIT_API_SECRET are not set; skipping");
            return;
        }
        privateSession.addListener(new RunnerListener(privateSession));
        if (orderTrackingEnabled && orderManager.setupDatabase()) {
            orderManager.startOrderTracking(null);
        }
        accountStream.subscribeExecutions(e -> log.info("Execution {} {} {} @ {} (order {})",
                e.symbol(), e.side(), e.execQty(), e.execPrice(), e.orderId()));
        accountStream.subscribeWallet(w -> log.info("Wallet {}: {}", w.accountType(), w.coins()));
        connect(privateSession);
    }

    private static void connect(ConnectionSession session) {
        try {
            session.connect();
        } catch (ConnectionException e) {
            log.error("Session {} could not connect: {}", session.name(), e.getMessage());
        }
    }

    private final class RunnerListener implements SessionListener {

        private final ConnectionSession session;

        RunnerListener(ConnectionSession session) {
            this.session = session;
        }

        @Override
        public void onSubscriptionRejected(SubscriptionRejection rejection) {
            log.warn("[{}] Subscription rejected: topic={} reason={}", session.name(), rejection.topic(), rejection.reason());
            if (unsubscribeRejected && rejection.topic() != null) {
                session.unsubscribe(rejection.topic());
            }
        }

        @Override
        public void onConnectionFailed(ConnectionException error) {
            log.error("[{}] Gave up reconnecting: {}", session.name(), error.getMessage());
        }
    }
}
