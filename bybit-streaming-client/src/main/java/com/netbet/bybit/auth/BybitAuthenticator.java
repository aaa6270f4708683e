package com.netbet.bybit.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.stream.SessionAuthenticator;
import com.netbet.bybit.stream.StreamMessages;
import com.netbet.bybit.stream.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Private-channel handshake: sends the {@code auth} op and waits for its ack on the fresh transport,
 * before the session replays subscriptions. Frames other than the auth ack are skipped.
 */
@Component
public class BybitAuthenticator implements SessionAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(BybitAuthenticator.class);
    private static final long EXPIRES_AHEAD_MS = 10_000;

    private final ApiCredentials credentials;
    private final BybitSigner signer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public BybitAuthenticator(ApiCredentials credentials, BybitSigner signer, ObjectMapper objectMapper, Clock clock) {
        this.credentials = credentials;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void authenticate(StreamTransport transport, Duration timeout) throws IOException {
        if (!credentials.isPresent()) {
            throw new AuthenticationException("API key/secret not configured");
        }
        long expires = clock.millis() + EXPIRES_AHEAD_MS;
        String reqId = "auth-" + sequence.incrementAndGet();
        transport.send(StreamMessages.authentication(reqId, credentials.apiKey(), expires, signer.streamSignature(expires)));

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                throw new AuthenticationException("No auth response within " + timeout.toMillis() + " ms");
            }
            String frame;
            try {
                frame = transport.receive(Duration.ofNanos(remainingNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while authenticating");
            }
            if (frame == null) {
                continue;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(frame);
            } catch (JsonProcessingException e) {
                log.debug("Skipping unparseable frame during auth: {}", e.getOriginalMessage());
                continue;
            }
            if (!"auth".equals(root.path("op").asText(null))) {
                log.debug("Skipping non-auth frame during auth: {}", frame);
                continue;
            }
            if (root.path("success").asBoolean(false)) {
                log.info("Private stream authenticated (req_id={})", reqId);
                return;
            }
            String reason = root.path("ret_msg").asText("unknown");
            log.error("Private stream authentication rejected: {}", reason);
            throw new AuthenticationException("Authentication rejected: " + reason);
        }
    }
}
