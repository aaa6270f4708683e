package com.netbet.bybit.stream;

import java.io.EOFException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory transport. Tests push inbound frames with {@link #deliver} and break the connection
 * with {@link #drop}; every frame the session writes is kept in {@link #sent()}.
 */
public class FakeTransport implements StreamTransport {

    private static final String EOF_MARKER = new String("<eof>");

    private final FakeTransportFactory factory;
    private final IOException connectFailure;
    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();

    private volatile boolean open;
    private volatile boolean closed;
    private volatile IOException failure;

    FakeTransport(FakeTransportFactory factory, IOException connectFailure) {
        this.factory = factory;
        this.connectFailure = connectFailure;
    }

    @Override
    public void connect(Duration timeout) throws IOException {
        factory.beforeConnect();
        if (connectFailure != null) {
            throw connectFailure;
        }
        open = true;
    }

    @Override
    public void send(String frame) throws IOException {
        if (!open || closed) {
            throw new IOException("fake transport not open");
        }
        sent.add(frame);
    }

    @Override
    public String receive(Duration timeout) throws IOException, InterruptedException {
        IOException f = failure;
        if (f != null) {
            throw f;
        }
        String frame = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (frame == EOF_MARKER) {
            inbound.offer(EOF_MARKER);
            throw failure != null ? failure : new EOFException("closed");
        }
        return frame;
    }

    @Override
    public void close() {
        closed = true;
        open = false;
        if (failure == null) {
            failure = new EOFException("closed locally");
        }
        inbound.offer(EOF_MARKER);
    }

    @Override
    public boolean isOpen() {
        return open && !closed;
    }

    public void deliver(String frame) {
        inbound.offer(frame);
    }

    /** Simulate the venue dropping the connection. */
    public void drop() {
        failure = new EOFException("dropped by test");
        open = false;
        inbound.offer(EOF_MARKER);
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> sent() {
        return List.copyOf(sent);
    }

    public long countSent(String frame) {
        return sent.stream().filter(frame::equals).count();
    }

    public List<String> sentSubscribes() {
        return sent.stream().filter(s -> s.contains("\"op\":\"subscribe\"")).toList();
    }
}
