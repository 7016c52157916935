package com.strategylab.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Performance metrics of one backtest run, keyed by metric name.
 *
 * <p>Evaluators report metrics under varying names. {@link #normalize(Map)} folds the
 * known aliases ({@code total_return}, {@code CAGR}, {@code Sharpe}/{@code sharpe},
 * {@code Sortino}/{@code sortino}, {@code max_drawdown}) into the canonical keys below
 * and keeps every other finite numeric entry as reported. Keys are kept sorted so CSV
 * columns are stable across runs.
 */
@EqualsAndHashCode
@ToString
public class RunMetrics {

    public static final String TOTAL_RETURN = "totalReturn";
    public static final String CAGR = "cagr";
    public static final String SHARPE_RATIO = "sharpeRatio";
    public static final String SORTINO_RATIO = "sortinoRatio";
    public static final String MAX_DRAWDOWN = "maxDrawdown";
    public static final String VOLATILITY = "volatility";

    private final Map<String, Double> values;

    private RunMetrics(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    /** Wraps already-normalized values, e.g. when reading persisted runs back. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RunMetrics of(Map<String, Double> values) {
        return new RunMetrics(values != null ? values : Map.of());
    }

    public static RunMetrics empty() {
        return new RunMetrics(Map.of());
    }

    /**
     * Builds metrics from a raw evaluator payload. Non-numeric and non-finite values are
     * dropped; missing canonical metrics default to 0 so every successful run reports them.
     */
    public static RunMetrics normalize(Map<String, ?> raw) {
        Map<String, Double> numeric = new TreeMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> {
                Double parsed = toFiniteDouble(value);
                if (key != null && parsed != null) {
                    numeric.put(key, parsed);
                }
            });
        }

        Map<String, Double> out = new TreeMap<>(numeric);
        out.put(TOTAL_RETURN, firstOf(numeric, TOTAL_RETURN, "total_return"));
        out.put(CAGR, firstOf(numeric, CAGR, "CAGR"));
        out.put(SHARPE_RATIO, firstOf(numeric, SHARPE_RATIO, "sharpe", "Sharpe"));
        out.put(SORTINO_RATIO, firstOf(numeric, SORTINO_RATIO, "sortino", "Sortino"));
        out.put(MAX_DRAWDOWN, firstOf(numeric, MAX_DRAWDOWN, "max_drawdown"));
        for (String alias : new String[] {"total_return", "CAGR", "sharpe", "Sharpe", "sortino", "Sortino", "max_drawdown"}) {
            out.remove(alias);
        }
        return new RunMetrics(out);
    }

    @JsonValue
    public Map<String, Double> toMap() {
        return values;
    }

    public Double get(String name) {
        return values.get(name);
    }

    public Double getTotalReturn() {
        return values.get(TOTAL_RETURN);
    }

    public Double getSharpeRatio() {
        return values.get(SHARPE_RATIO);
    }

    public Double getMaxDrawdown() {
        return values.get(MAX_DRAWDOWN);
    }

    public Double getVolatility() {
        return values.get(VOLATILITY);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static double firstOf(Map<String, Double> numeric, String... keys) {
        for (String key : keys) {
            Double value = numeric.get(key);
            if (value != null) {
                return value;
            }
        }
        return 0.0;
    }

    private static Double toFiniteDouble(Object value) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                parsed = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }
}
