package com.strategylab.evaluator;

import com.strategylab.config.EvaluatorProperties;
import com.strategylab.domain.model.DateRange;
import com.strategylab.domain.model.Element;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.exception.EvaluatorException;
import com.strategylab.exception.TransientEvaluatorException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls the single-run backtest service over HTTP.
 *
 * <p>POSTs {@code {elements, benchmarkSymbol, startDate, endDate, debug:false}} and reads
 * the {@code metrics} object of the response. An {@code error} field in the response
 * body, a non-2xx status or an I/O failure become an {@link EvaluatorException} whose
 * message is the service's own error text when it provides one.
 *
 * <p>Unreachable service and 5xx answers raise {@link TransientEvaluatorException},
 * which the {@code backtestEvaluator} Resilience4j retry repeats and the circuit breaker
 * of the same name counts. Other failures belong to the strategy and are not retried.
 */
@Component
public class HttpBacktestEvaluator implements BacktestEvaluator {

    private static final Logger log = LoggerFactory.getLogger(HttpBacktestEvaluator.class);

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final EvaluatorProperties evaluatorProperties;

    public HttpBacktestEvaluator(
            @Qualifier("evaluatorRestTemplate") RestTemplate restTemplate, EvaluatorProperties evaluatorProperties) {
        this.restTemplate = restTemplate;
        this.evaluatorProperties = evaluatorProperties;
    }

    @Override
    @CircuitBreaker(name = "backtestEvaluator")
    @Retry(name = "backtestEvaluator")
    public RunMetrics runBacktest(List<Element> resolvedElements, String benchmarkSymbol, DateRange dateRange) {
        BacktestRequest request = BacktestRequest.builder()
                .elements(resolvedElements)
                .benchmarkSymbol(benchmarkSymbol != null ? benchmarkSymbol : evaluatorProperties.getDefaultBenchmark())
                .startDate(startDateOf(dateRange))
                .endDate(endDateOf(dateRange))
                .debug(false)
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body;
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    evaluatorProperties.getUrl(), HttpMethod.POST, new HttpEntity<>(request, headers), RESPONSE_TYPE);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            String message = errorTextOf(e);
            log.warn("Backtest service returned {}: {}", e.getStatusCode().value(), message);
            if (e.getStatusCode().is5xxServerError()) {
                throw new TransientEvaluatorException(message, e);
            }
            throw new EvaluatorException(message, e);
        } catch (ResourceAccessException e) {
            log.warn("Backtest service unreachable: {}", e.getMessage());
            throw new TransientEvaluatorException("Backtest service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.warn("Backtest call failed: {}", e.getMessage());
            throw new EvaluatorException("Backtest call failed: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new EvaluatorException("Backtest service returned an empty response");
        }
        Object error = body.get("error");
        if (error != null) {
            throw new EvaluatorException(String.valueOf(error));
        }
        Object metrics = body.get("metrics");
        if (!(metrics instanceof Map<?, ?> rawMetrics)) {
            throw new EvaluatorException("Backtest response has no metrics");
        }
        return RunMetrics.normalize(toStringKeyed(rawMetrics));
    }

    private String startDateOf(DateRange dateRange) {
        if (dateRange == null || dateRange.getStartDate() == null || dateRange.getStartDate().isBlank()) {
            return evaluatorProperties.getDefaultStartDate();
        }
        return dateRange.getStartDate();
    }

    private static String endDateOf(DateRange dateRange) {
        if (dateRange == null || dateRange.getEndDate() == null || dateRange.getEndDate().isBlank()) {
            return LocalDate.now().toString();
        }
        return dateRange.getEndDate();
    }

    private static Map<String, Object> toStringKeyed(Map<?, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((key, value) -> out.put(String.valueOf(key), value));
        return out;
    }

    /** Uses the {@code error} field of a JSON error body when there is one. */
    private static String errorTextOf(HttpStatusCodeException e) {
        try {
            Map<?, ?> errorBody = e.getResponseBodyAs(Map.class);
            if (errorBody != null && errorBody.get("error") != null) {
                return String.valueOf(errorBody.get("error"));
            }
        } catch (RuntimeException parseFailure) {
            log.debug("Backtest error body is not JSON: {}", parseFailure.getMessage());
        }
        String text = e.getResponseBodyAsString();
        return text.isBlank() ? "Backtest service returned " + e.getStatusCode().value() : text;
    }
}
