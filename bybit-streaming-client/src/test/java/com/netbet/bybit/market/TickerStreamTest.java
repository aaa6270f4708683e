package com.netbet.bybit.market;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.bybit.stream.ConnectionSession;
import com.netbet.bybit.subscription.TopicHandler;
import com.netbet.bybit.subscription.TopicMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TickerStreamTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TickerCache cache = new TickerCache();

    @Mock
    private ConnectionSession session;

    private TickerStream stream;

    @BeforeEach
    void setUp() {
        stream = new TickerStream(session, cache);
    }

    @Test
    void subscribeNormalizesSymbolAndCachesSnapshot() throws Exception {
        List<TickerData> seen = new ArrayList<>();
        String topic = stream.subscribe(" btcusdt", seen::add);

        assertThat(topic).isEqualTo("tickers.BTCUSDT");
        TopicHandler handler = captureHandler("tickers.BTCUSDT");
        handler.onMessage(message("snapshot", 1700000000000L,
                "{\"symbol\":\"BTCUSDT\",\"lastPrice\":\"65000.1\",\"bid1Price\":\"65000\",\"ask1Price\":\"65000.2\","
                        + "\"highPrice24h\":\"66000\",\"lowPrice24h\":\"64000\",\"volume24h\":\"1234.5\",\"price24hPcnt\":\"0.0123\"}"));

        TickerData t = cache.get("BTCUSDT").orElseThrow();
        assertThat(t.lastPrice()).isEqualByComparingTo("65000.1");
        assertThat(t.bidPrice()).isEqualByComparingTo("65000");
        assertThat(t.askPrice()).isEqualByComparingTo("65000.2");
        assertThat(t.priceChange24h()).isEqualByComparingTo("0.0123");
        assertThat(t.timestamp()).isEqualTo(1700000000000L);
        assertThat(seen).containsExactly(t);
    }

    @Test
    void deltaMergesOntoPreviousSnapshot() throws Exception {
        stream.subscribe("ETHUSDT");
        TopicHandler handler = captureHandler("tickers.ETHUSDT");

        handler.onMessage(message("snapshot", 10L, "{\"symbol\":\"ETHUSDT\",\"lastPrice\":\"3000\",\"bidPrice\":\"2999\"}"));
        handler.onMessage(message("delta", 20L, "{\"symbol\":\"ETHUSDT\",\"lastPrice\":\"3001\"}"));

        TickerData t = cache.get("ETHUSDT").orElseThrow();
        assertThat(t.lastPrice()).isEqualByComparingTo(new BigDecimal("3001"));
        assertThat(t.bidPrice()).isEqualByComparingTo(new BigDecimal("2999"));
        assertThat(t.timestamp()).isEqualTo(20L);
    }

    @Test
    void missingTimestampFallsBackToReceiveTime() throws Exception {
        stream.subscribe("SOLUSDT");
        TopicHandler handler = captureHandler("tickers.SOLUSDT");

        handler.onMessage(new TopicMessage("tickers.SOLUSDT", "snapshot",
                mapper.readTree("{\"lastPrice\":\"150\"}"), -1, 777L));

        TickerData t = cache.get("SOLUSDT").orElseThrow();
        assertThat(t.symbol()).isEqualTo("SOLUSDT");
        assertThat(t.timestamp()).isEqualTo(777L);
    }

    @Test
    void unsubscribeRemovesCachedTicker() throws Exception {
        stream.subscribe("BTCUSDT");
        captureHandler("tickers.BTCUSDT").onMessage(message("snapshot", 1L, "{\"symbol\":\"BTCUSDT\",\"lastPrice\":\"1\"}"));
        when(session.unsubscribe("tickers.BTCUSDT")).thenReturn(true);

        assertThat(stream.unsubscribe("btcusdt")).isTrue();
        assertThat(cache.get("BTCUSDT")).isEmpty();
    }

    private TopicHandler captureHandler(String topic) {
        ArgumentCaptor<TopicHandler> captor = ArgumentCaptor.forClass(TopicHandler.class);
        verify(session).subscribe(eq(topic), captor.capture());
        return captor.getValue();
    }

    private TopicMessage message(String type, long ts, String data) throws Exception {
        return new TopicMessage("tickers.X", type, mapper.readTree(data), ts, 0L);
    }
}
