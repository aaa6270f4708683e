package com.netbet.bybit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.auth.ApiCredentials;
import com.netbet.bybit.auth.BybitAuthenticator;
import com.netbet.bybit.stream.ConnectionSession;
import com.netbet.bybit.stream.JdkWebSocketTransport;
import com.netbet.bybit.stream.SessionAuthenticator;
import com.netbet.bybit.stream.SessionSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class StreamingConfig {

    @Bean
    public RestClient.Builder restClientBuilder() {
        return RestClient.builder();
    }

    @Bean
    public HttpClient streamHttpClient(@Value("${bybit.session.connect-timeout-ms:10000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Depends on EnvConfig so keys from the .env file are visible here. */
    @Bean
    @DependsOn("envConfig")
    public ApiCredentials apiCredentials(@Value("${bybit.api-key:}") String apiKey,
                                         @Value("${bybit.api-secret:}") String apiSecret) {
        return new ApiCredentials(apiKey, apiSecret);
    }

    @Bean
    public SessionSettings sessionSettings(@Value("${bybit.session.heartbeat-interval-ms:20000}") long heartbeatIntervalMs,
                                           @Value("${bybit.session.stale-multiplier:2.0}") double staleMultiplier,
                                           @Value("${bybit.session.connect-timeout-ms:10000}") long connectTimeoutMs,
                                           @Value("${bybit.session.read-timeout-ms:1000}") long readTimeoutMs,
                                           @Value("${bybit.session.reconnect-base-delay-ms:500}") long reconnectBaseDelayMs,
                                           @Value("${bybit.session.reconnect-max-delay-ms:30000}") long reconnectMaxDelayMs,
                                           @Value("${bybit.session.max-connect-attempts:10}") int maxConnectAttempts) {
        return new SessionSettings(
                Duration.ofMillis(heartbeatIntervalMs),
                staleMultiplier,
                Duration.ofMillis(connectTimeoutMs),
                Duration.ofMillis(readTimeoutMs),
                Duration.ofMillis(reconnectBaseDelayMs),
                Duration.ofMillis(reconnectMaxDelayMs),
                maxConnectAttempts);
    }

    @Bean(destroyMethod = "close")
    public ConnectionSession publicSession(HttpClient streamHttpClient,
                                           ObjectMapper objectMapper,
                                           SessionSettings sessionSettings,
                                           @Value("${bybit.public-stream-url:wss://stream-testnet.bybit.com/v5/public/spot}") String url,
                                           @Value("${bybit.max-frame-bytes:2097152}") int maxFrameChars) {
        URI uri = URI.create(url);
        return new ConnectionSession("public",
                () -> new JdkWebSocketTransport(streamHttpClient, uri, maxFrameChars),
                SessionAuthenticator.NONE, objectMapper, sessionSettings);
    }

    @Bean(destroyMethod = "close")
    public ConnectionSession privateSession(HttpClient streamHttpClient,
                                            ObjectMapper objectMapper,
                                            SessionSettings sessionSettings,
                                            BybitAuthenticator authenticator,
                                            @Value("${bybit.private-stream-url:wss://stream-testnet.bybit.com/v5/private}") String url,
                                            @Value("${bybit.max-frame-bytes:2097152}") int maxFrameChars) {
        URI uri = URI.create(url);
        return new ConnectionSession("private",
                () -> new JdkWebSocketTransport(streamHttpClient, uri, maxFrameChars),
                authenticator, objectMapper, sessionSettings);
    }
}
