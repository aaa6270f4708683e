package com.netbet.bybit.auth;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures for Bybit V5, lower-case hex.
 * Stream auth signs {@code "GET/realtime" + expires}; REST signs
 * {@code timestamp + apiKey + recvWindow + payload}.
 */
@Component
public class BybitSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final ApiCredentials credentials;

    public BybitSigner(ApiCredentials credentials) {
        this.credentials = credentials;
    }

    public String sign(String payload) {
        return hmacSha256Hex(credentials.apiSecret(), payload);
    }

    public String streamSignature(long expires) {
        return sign("GET/realtime" + expires);
    }

    public String restSignature(long timestamp, long recvWindowMs, String payload) {
        return sign(timestamp + credentials.apiKey() + recvWindowMs + (payload != null ? payload : ""));
    }

    static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to sign payload", e);
        }
    }
}
