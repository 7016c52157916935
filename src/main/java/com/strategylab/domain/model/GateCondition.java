package com.strategylab.domain.model;

import com.strategylab.domain.enums.CompareTo;
import com.strategylab.domain.enums.ComparisonOperator;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One comparison inside a gate: {@code indicator(ticker, period) operator rhs}, where the
 * right-hand side is either a fixed threshold or a second indicator reading.
 *
 * <p>Ticker, period, threshold and the right-hand ticker/period may each be a literal,
 * a variable token, or absent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GateCondition {

    private String ticker;
    private String indicator;
    private String period;
    private Map<String, String> params;
    private ComparisonOperator operator;
    private CompareTo compareTo;
    private String threshold;
    private String rightTicker;
    private String rightIndicator;
    private String rightPeriod;
    private Map<String, String> rightParams;
}
