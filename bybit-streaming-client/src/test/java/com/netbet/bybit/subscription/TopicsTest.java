package com.netbet.bybit.subscription;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicsTest {

    @Test
    void tickerTopicNormalizesSymbol() {
        assertThat(Topics.ticker(" btcusdt ")).isEqualTo("tickers.BTCUSDT");
        assertThat(Topics.symbolOf("tickers.ETHUSDT")).isEqualTo("ETHUSDT");
        assertThat(Topics.symbolOf("order")).isEqualTo("order");
        assertThat(Topics.isTicker("order")).isFalse();
        assertThatThrownBy(() -> Topics.ticker("  ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jsonFieldsTreatEmptyStringsAsAbsent() throws Exception {
        var node = new ObjectMapper().readTree("{\"a\":\"\",\"b\":\"1.50\",\"c\":\"x\",\"t\":\"1700\",\"n\":12}");

        assertThat(JsonFields.text(node, "a")).isNull();
        assertThat(JsonFields.decimal(node, "a", "b")).isEqualByComparingTo(new BigDecimal("1.5"));
        assertThat(JsonFields.decimal(node, "c")).isNull();
        assertThat(JsonFields.longValue(node, "t", -1)).isEqualTo(1700L);
        assertThat(JsonFields.longValue(node, "n", -1)).isEqualTo(12L);
        assertThat(JsonFields.longValue(node, "missing", -1)).isEqualTo(-1L);
    }
}
