package com.netbet.bybit.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.resilience.HeartbeatScheduler;
import com.netbet.bybit.resilience.ReconnectPolicy;
import com.netbet.bybit.router.HeartbeatHandler;
import com.netbet.bybit.router.MessageRouter;
import com.netbet.bybit.router.RouterStats;
import com.netbet.bybit.router.StatusHandler;
import com.netbet.bybit.router.SubscriptionRejection;
import com.netbet.bybit.subscription.Subscription;
import com.netbet.bybit.subscription.SubscriptionRegistry;
import com.netbet.bybit.subscription.TopicHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Self-healing publish/subscribe session over one {@link StreamTransport} at a time.
 * <p>
 * Lifecycle: connect with bounded backoff, start heartbeat, replay the subscription registry,
 * then a dedicated receive thread feeds the {@link MessageRouter}. Transport loss or heartbeat
 * staleness while connected moves the session to {@link SessionState#RECONNECTING} and a background
 * reconnect replays the registry again. The registry is never cleared by transport failure.
 * <p>
 * State transitions and all outbound writes happen under {@link #lock}, so there is a single writer
 * to the transport and replay cannot interleave with a concurrent subscribe.
 */
public class ConnectionSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);
    private static final long RECEIVE_JOIN_SLACK_MS = 1_000;

    private final String name;
    private final TransportFactory transportFactory;
    private final SessionAuthenticator authenticator;
    private final SessionSettings settings;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final HeartbeatScheduler heartbeat;
    private final MessageRouter router;
    private final ReconnectPolicy reconnectPolicy;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private final ExecutorService reconnectExecutor;

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile StreamTransport transport;
    private Thread receiveThread;

    public ConnectionSession(String name,
                             TransportFactory transportFactory,
                             SessionAuthenticator authenticator,
                             ObjectMapper objectMapper,
                             SessionSettings settings) {
        this.name = Objects.requireNonNull(name, "name");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.authenticator = authenticator != null ? authenticator : SessionAuthenticator.NONE;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.heartbeat = new HeartbeatScheduler(name, settings.heartbeatInterval(), settings.staleAfter());
        this.router = new MessageRouter(objectMapper, registry,
                new HeartbeatHandler(heartbeat), new StatusHandler(this::notifyRejected));
        this.reconnectPolicy = new ReconnectPolicy(
                settings.reconnectBaseDelay().toMillis(), settings.reconnectMaxDelay().toMillis());
        this.reconnectExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Establish the connection, retrying with backoff. Blocks until connected or the retry budget is spent.
     *
     * @throws ConnectionException   when every attempt failed; the session is DISCONNECTED afterwards
     * @throws IllegalStateException when the session is closing or closed
     */
    public void connect() throws ConnectionException {
        lock.lock();
        try {
            if (state.isTerminating()) {
                throw new IllegalStateException("Session " + name + " is " + state);
            }
            if (state != SessionState.DISCONNECTED) {
                log.debug("[{}] connect() ignored in state {}", name, state);
                return;
            }
            transition(SessionState.CONNECTING);
        } finally {
            lock.unlock();
        }
        establishWithRetry();
    }

    /**
     * Register (or replace) the handler for {@code topic}. Sends a subscribe request when connected and
     * the topic was not already active; otherwise the topic is replayed on the next connect.
     */
    public void subscribe(String topic, TopicHandler handler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must be non-null and non-blank");
        }
        Objects.requireNonNull(handler, "handler");
        lock.lock();
        try {
            if (state.isTerminating()) {
                throw new IllegalStateException("Session " + name + " is " + state);
            }
            if (!registry.upsert(topic, handler)) {
                log.debug("[{}] Handler replaced for active topic {}", name, topic);
                return;
            }
            if (state == SessionState.CONNECTED) {
                sendLocked(StreamMessages.subscribe(topic), "subscribe " + topic);
            } else {
                log.info("[{}] Subscription {} queued until connected (state={})", name, topic, state);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deactivate {@code topic}. Frames for it are dropped from now on, even those already in flight.
     *
     * @return false if the topic was not subscribed
     */
    public boolean unsubscribe(String topic) {
        lock.lock();
        try {
            if (!registry.deactivate(topic)) {
                log.debug("[{}] unsubscribe({}) ignored: not subscribed", name, topic);
                return false;
            }
            if (state == SessionState.CONNECTED) {
                sendLocked(StreamMessages.unsubscribe(topic), "unsubscribe " + topic);
            }
            log.info("[{}] Unsubscribed from {}", name, topic);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Stop heartbeat and receive loop, release the transport. Idempotent; CLOSED is terminal. */
    @Override
    public void close() {
        StreamTransport current;
        Thread receiver;
        lock.lock();
        try {
            if (state.isTerminating()) {
                return;
            }
            transition(SessionState.CLOSING);
            current = transport;
            transport = null;
            receiver = receiveThread;
            receiveThread = null;
        } finally {
            lock.unlock();
        }
        closeSignal.countDown();
        heartbeat.stop();
        if (current != null) {
            current.close();
        }
        reconnectExecutor.shutdownNow();
        joinReceiver(receiver);

        lock.lock();
        try {
            transition(SessionState.CLOSED);
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    public SessionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == SessionState.CONNECTED;
    }

    /** All registry entries in insertion order, inactive ones included. */
    public List<Subscription> subscriptions() {
        return registry.entries();
    }

    public boolean isSubscribed(String topic) {
        return registry.isActive(topic);
    }

    public RouterStats routerStats() {
        return router.stats();
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    HeartbeatScheduler heartbeat() {
        return heartbeat;
    }

    SubscriptionRegistry registry() {
        return registry;
    }

    private void establishWithRetry() throws ConnectionException {
        reconnectPolicy.reset();
        Exception lastFailure = null;
        int maxAttempts = settings.maxConnectAttempts();
        for (int attempt = 1; ; attempt++) {
            if (state.isTerminating()) {
                return;
            }
            StreamTransport candidate = null;
            try {
                candidate = transportFactory.create();
                candidate.connect(settings.connectTimeout());
                authenticator.authenticate(candidate, settings.connectTimeout());
                activate(candidate);
                return;
            } catch (IOException | RuntimeException e) {
                closeQuietly(candidate);
                lastFailure = e;
                if (e instanceof RuntimeException) {
                    log.error("[{}] Connect attempt {}/{} failed unexpectedly", name, attempt, maxAttempts, e);
                } else {
                    log.warn("[{}] Connect attempt {}/{} failed: {}", name, attempt, maxAttempts, e.getMessage());
                }
            }
            if (attempt >= maxAttempts) {
                break;
            }
            try {
                if (closeSignal.await(reconnectPolicy.nextDelayMs(), TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (state.isTerminating()) {
                    return;
                }
                giveUp();
                throw new ConnectionException("Interrupted while connecting session " + name, e);
            }
        }
        giveUp();
        throw new ConnectionException("Session " + name + " failed to connect after " + maxAttempts + " attempts", lastFailure);
    }

    private void closeQuietly(StreamTransport candidate) {
        if (candidate == null) {
            return;
        }
        try {
            candidate.close();
        } catch (RuntimeException e) {
            log.debug("[{}] Closing failed transport threw: {}", name, e.getMessage());
        }
    }

    private void giveUp() {
        lock.lock();
        try {
            if (state == SessionState.CONNECTING || state == SessionState.RECONNECTING) {
                transition(SessionState.DISCONNECTED);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Promote a connected transport to the live one and replay the registry. */
    private void activate(StreamTransport candidate) {
        IOException replayFailure = null;
        lock.lock();
        try {
            if (state != SessionState.CONNECTING && state != SessionState.RECONNECTING) {
                log.debug("[{}] Discarding transport established during {}", name, state);
                candidate.close();
                return;
            }
            transport = candidate;
            transition(SessionState.CONNECTED);
            heartbeat.start(reqId -> sendPing(candidate, reqId),
                    () -> onConnectionLost(candidate, new StaleConnectionException(
                            "No inbound traffic for more than " + heartbeat.staleAfter().toMillis() + " ms")));
            Thread receiver = new Thread(() -> receiveLoop(candidate), name + "-receive");
            receiver.setDaemon(true);
            receiveThread = receiver;
            receiver.start();

            List<Subscription> active = registry.activeEntries();
            for (Subscription s : active) {
                try {
                    candidate.send(StreamMessages.subscribe(s.topic()));
                } catch (IOException e) {
                    replayFailure = e;
                    break;
                }
            }
            log.info("[{}] Connected; replayed {} subscription(s)", name, active.size());
        } finally {
            lock.unlock();
        }
        reconnectPolicy.reset();
        if (replayFailure != null) {
            onConnectionLost(candidate, replayFailure);
        }
    }

    private void receiveLoop(StreamTransport source) {
        try {
            while (isLive(source)) {
                String frame = source.receive(settings.readTimeout());
                if (frame == null) {
                    continue;
                }
                heartbeat.recordInbound();
                if (!isLive(source)) {
                    return;
                }
                router.route(frame, System.currentTimeMillis());
            }
        } catch (IOException e) {
            onConnectionLost(source, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            log.error("[{}] Receive loop failed", name, e);
            onConnectionLost(source, new IOException("Receive loop failed", e));
            if (e instanceof VirtualMachineError vme) {
                throw vme;
            }
        }
    }

    private boolean isLive(StreamTransport source) {
        return state == SessionState.CONNECTED && transport == source;
    }

    private void onConnectionLost(StreamTransport source, IOException cause) {
        lock.lock();
        try {
            if (!isLive(source)) {
                log.debug("[{}] Ignoring loss of a transport that is no longer live: {}", name, cause.getMessage());
                return;
            }
            transport = null;
            receiveThread = null;
            transition(SessionState.RECONNECTING);
        } finally {
            lock.unlock();
        }
        log.warn("[{}] Connection lost ({}); reconnecting", name, cause.toString());
        try {
            reconnectExecutor.execute(() -> reconnect(source));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Reconnect not scheduled, session is closing", name);
        }
    }

    private void reconnect(StreamTransport lost) {
        ConnectionException failure;
        try {
            heartbeat.stop();
            closeQuietly(lost);
            establishWithRetry();
            return;
        } catch (ConnectionException e) {
            failure = e;
        } catch (RuntimeException e) {
            giveUp();
            failure = new ConnectionException("Reconnect of session " + name + " failed", e);
        }
        if (state.isTerminating()) {
            return;
        }
        log.error("[{}] Reconnect gave up: {}", name, failure.getMessage());
        for (SessionListener l : listeners) {
            try {
                l.onConnectionFailed(failure);
            } catch (RuntimeException ex) {
                log.warn("[{}] Listener failed on connection failure: {}", name, ex.getMessage());
            }
        }
    }

    private void sendPing(StreamTransport target, String reqId) throws IOException {
        lock.lock();
        try {
            if (!isLive(target)) {
                return;
            }
            target.send(StreamMessages.ping(reqId));
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds {@link #lock}. A failed write is left to the receive loop to detect. */
    private void sendLocked(String frame, String what) {
        StreamTransport current = transport;
        if (current == null) {
            return;
        }
        try {
            current.send(frame);
            log.info("[{}] Sent {}", name, what);
        } catch (IOException e) {
            log.warn("[{}] Failed to send {} ({}); will replay after reconnect", name, what, e.getMessage());
        }
    }

    /** Caller holds {@link #lock}. */
    private void transition(SessionState next) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.info("[{}] {} -> {}", name, previous, next);
        for (SessionListener l : listeners) {
            try {
                l.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                log.warn("[{}] Listener failed on state change: {}", name, e.getMessage());
            }
        }
    }

    private void notifyRejected(SubscriptionRejection rejection) {
        for (SessionListener l : listeners) {
            try {
                l.onSubscriptionRejected(rejection);
            } catch (RuntimeException e) {
                log.warn("[{}] Listener failed on subscription rejection: {}", name, e.getMessage());
            }
        }
    }

    private void joinReceiver(Thread receiver) {
        if (receiver == null || receiver == Thread.currentThread()) {
            return;
        }
        try {
            receiver.join(settings.readTimeout().toMillis() + RECEIVE_JOIN_SLACK_MS);
            if (receiver.isAlive()) {
                log.warn("[{}] Receive thread still running after close", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
