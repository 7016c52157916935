package com.strategylab.unit.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.strategylab.config.EvaluatorProperties;
import com.strategylab.domain.model.DateRange;
import com.strategylab.domain.model.Element;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.domain.model.TickerElement;
import com.strategylab.evaluator.HttpBacktestEvaluator;
import com.strategylab.exception.EvaluatorException;
import com.strategylab.exception.TransientEvaluatorException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

/**
 * Unit tests for HttpBacktestEvaluator covering the request body, metric normalization
 * and how service failures are classified.
 */
class HttpBacktestEvaluatorTest {

    private static final String URL = "http://evaluator.test/api/backtest_strategy";

    private MockRestServiceServer server;
    private HttpBacktestEvaluator evaluator;

    private final List<Element> elements = List.of(TickerElement.builder().ticker("SPY").weight("100").build());

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        EvaluatorProperties properties = new EvaluatorProperties();
        properties.setUrl(URL);
        evaluator = new HttpBacktestEvaluator(restTemplate, properties);
    }

    @Test
    @DisplayName("posts the resolved strategy and normalizes the returned metrics")
    void success() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.elements[0].type").value("ticker"))
                .andExpect(jsonPath("$.elements[0].ticker").value("SPY"))
                .andExpect(jsonPath("$.benchmarkSymbol").value("QQQ"))
                .andExpect(jsonPath("$.startDate").value("2020-01-01"))
                .andExpect(jsonPath("$.endDate").value("2024-12-31"))
                .andExpect(jsonPath("$.debug").value(false))
                .andRespond(withSuccess(
                        "{\"metrics\":{\"total_return\":0.31,\"sharpe\":1.4,\"max_drawdown\":-0.12}}",
                        MediaType.APPLICATION_JSON));

        RunMetrics metrics = evaluator.runBacktest(elements, "QQQ", DateRange.of("2020-01-01", "2024-12-31"));

        assertThat(metrics.getTotalReturn()).isEqualTo(0.31);
        assertThat(metrics.getSharpeRatio()).isEqualTo(1.4);
        assertThat(metrics.getMaxDrawdown()).isEqualTo(-0.12);
        server.verify();
    }

    @Test
    @DisplayName("missing dates default to the full history and the default benchmark")
    void defaults() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.startDate").value("max"))
                .andExpect(jsonPath("$.benchmarkSymbol").value("SPY"))
                .andRespond(withSuccess("{\"metrics\":{\"totalReturn\":0.1}}", MediaType.APPLICATION_JSON));

        evaluator.runBacktest(elements, null, DateRange.of(null, null));

        server.verify();
    }

    @Test
    @DisplayName("an error field in a 200 body fails the run with that message")
    void errorInBody() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"error\":\"Unknown ticker ZZZZ\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> evaluator.runBacktest(elements, "SPY", null))
                .isInstanceOf(EvaluatorException.class)
                .isNotInstanceOf(TransientEvaluatorException.class)
                .hasMessage("Unknown ticker ZZZZ");
    }

    @Test
    @DisplayName("a 4xx answer is a permanent failure carrying the service's error text")
    void clientError() {
        server.expect(requestTo(URL))
                .andRespond(withBadRequest()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Elements array is required\"}"));

        assertThatThrownBy(() -> evaluator.runBacktest(elements, "SPY", null))
                .isInstanceOf(EvaluatorException.class)
                .isNotInstanceOf(TransientEvaluatorException.class)
                .hasMessage("Elements array is required");
    }

    @Test
    @DisplayName("a 5xx answer is transient")
    void serverError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> evaluator.runBacktest(elements, "SPY", null))
                .isInstanceOf(TransientEvaluatorException.class);
    }

    @Test
    @DisplayName("a body without metrics fails the run")
    void noMetrics() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> evaluator.runBacktest(elements, "SPY", null))
                .isInstanceOf(EvaluatorException.class)
                .hasMessageContaining("no metrics");
    }
}
