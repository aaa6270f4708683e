package com.netbet.bybit.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket transport on {@code java.net.http}. Inbound text frames are reassembled and queued by
 * the listener; the session's receive thread drains the queue. Max frame length guard breaks the
 * connection on corrupted or runaway frames.
 */
public class JdkWebSocketTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(1);

    /** Queue element; {@link #END} marks that no more frames will arrive. */
    private record Inbound(String text) {}

    private static final Inbound END = new Inbound(null);

    private final HttpClient httpClient;
    private final URI uri;
    private final int maxFrameChars;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile WebSocket webSocket;
    private volatile IOException failure;

    public JdkWebSocketTransport(HttpClient httpClient, URI uri, int maxFrameChars) {
        this.httpClient = httpClient;
        this.uri = uri;
        this.maxFrameChars = maxFrameChars;
    }

    @Override
    public void connect(Duration timeout) throws IOException {
        if (webSocket != null || closed.get()) {
            throw new IllegalStateException("Transport to " + uri + " is single-use");
        }
        CompletableFuture<WebSocket> future = httpClient.newWebSocketBuilder()
                .connectTimeout(timeout)
                .buildAsync(uri, new FrameListener());
        webSocket = await(future, timeout, "connect to " + uri);
        log.info("Connected to {}", uri);
    }

    @Override
    public void send(String frame) throws IOException {
        WebSocket ws = webSocket;
        if (ws == null || ws.isOutputClosed() || closed.get()) {
            throw new IOException("Transport to " + uri + " is not open");
        }
        await(ws.sendText(frame, true), SEND_TIMEOUT, "send to " + uri);
    }

    @Override
    public String receive(Duration timeout) throws IOException, InterruptedException {
        Inbound next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return null;
        }
        if (next == END) {
            inbound.offer(END);
            IOException cause = failure;
            throw cause != null ? cause : new EOFException("Transport to " + uri + " closed");
        }
        return next.text();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = webSocket;
        if (ws != null) {
            try {
                if (!ws.isOutputClosed()) {
                    ws.sendClose(WebSocket.NORMAL_CLOSURE, "").get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (ExecutionException | TimeoutException e) {
                log.debug("Graceful close of {} failed: {}", uri, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                ws.abort();
            }
        }
        fail(new EOFException("Transport to " + uri + " closed locally"));
        log.debug("Transport to {} released", uri);
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = webSocket;
        return ws != null && !closed.get() && !ws.isInputClosed() && !ws.isOutputClosed();
    }

    private void fail(IOException cause) {
        if (failure == null) {
            failure = cause;
        }
        inbound.offer(END);
    }

    private static <T> T await(CompletableFuture<T> future, Duration timeout, String what) throws IOException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new InterruptedIOException("Interrupted during " + what);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException(what + " timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(what + " failed: " + cause, cause);
        }
    }

    private final class FrameListener implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder(4096);

        @Override
        public void onOpen(WebSocket ws) {
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buffer.append(data);
            if (buffer.length() > maxFrameChars) {
                log.error("Frame exceeded max length ({} chars) on {}; breaking connection to reconnect", maxFrameChars, uri);
                buffer.setLength(0);
                fail(new IOException("Frame exceeded max length " + maxFrameChars));
                ws.abort();
                return null;
            }
            if (last) {
                inbound.offer(new Inbound(buffer.toString()));
                buffer.setLength(0);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
            log.trace("Ignoring binary frame ({} bytes) from {}", data.remaining(), uri);
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            log.info("Venue closed {} (status={} reason={})", uri, statusCode, reason);
            fail(new EOFException("Closed by venue: status=" + statusCode + " reason=" + reason));
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            log.warn("WebSocket error on {}: {}", uri, error.toString());
            fail(error instanceof IOException io ? io : new IOException("WebSocket error on " + uri, error));
        }
    }
}
