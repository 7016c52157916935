package com.strategylab.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The base strategy of a batch: root elements plus the backtest window and benchmark
 * shared by every run. {@code startDate}/{@code endDate} use {@code YYYY-MM-DD}; null
 * means the evaluator's default (full history / today).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StrategyDefinition {

    private List<Element> elements;
    private String benchmarkSymbol;
    private String startDate;
    private String endDate;
}
