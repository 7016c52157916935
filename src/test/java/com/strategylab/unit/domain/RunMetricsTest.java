package com.strategylab.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategylab.domain.model.RunMetrics;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for RunMetrics normalization of evaluator payloads. */
class RunMetricsTest {

    @Test
    @DisplayName("aliases fold into canonical keys and are removed")
    void aliasesFolded() {
        RunMetrics metrics = RunMetrics.normalize(
                Map.of("total_return", 0.42, "Sharpe", 1.1, "max_drawdown", -0.2, "CAGR", 0.08));

        assertThat(metrics.getTotalReturn()).isEqualTo(0.42);
        assertThat(metrics.getSharpeRatio()).isEqualTo(1.1);
        assertThat(metrics.getMaxDrawdown()).isEqualTo(-0.2);
        assertThat(metrics.get(RunMetrics.CAGR)).isEqualTo(0.08);
        assertThat(metrics.toMap()).doesNotContainKeys("total_return", "Sharpe", "max_drawdown", "CAGR");
    }

    @Test
    @DisplayName("canonical keys win over aliases and missing ones default to zero")
    void canonicalWinsAndDefaults() {
        RunMetrics metrics = RunMetrics.normalize(Map.of("totalReturn", 0.3, "total_return", 0.9));

        assertThat(metrics.getTotalReturn()).isEqualTo(0.3);
        assertThat(metrics.getSharpeRatio()).isZero();
        assertThat(metrics.get(RunMetrics.SORTINO_RATIO)).isZero();
    }

    @Test
    @DisplayName("numeric strings are parsed; text, NaN and infinities are dropped")
    void nonNumericDropped() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("totalReturn", "0.15");
        raw.put("label", "good");
        raw.put("volatility", Double.NaN);
        raw.put("beta", Double.POSITIVE_INFINITY);
        raw.put("winRate", 0.6);

        RunMetrics metrics = RunMetrics.normalize(raw);

        assertThat(metrics.getTotalReturn()).isEqualTo(0.15);
        assertThat(metrics.toMap()).doesNotContainKeys("label", "volatility", "beta").containsEntry("winRate", 0.6);
    }

    @Test
    @DisplayName("serializes as a flat JSON object and reads back")
    void jsonShape() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        RunMetrics metrics = RunMetrics.of(Map.of("totalReturn", 0.5, "cagr", 0.1));

        String json = mapper.writeValueAsString(metrics);

        assertThat(json).isEqualTo("{\"cagr\":0.1,\"totalReturn\":0.5}");
        assertThat(mapper.readValue(json, RunMetrics.class)).isEqualTo(metrics);
    }
}
