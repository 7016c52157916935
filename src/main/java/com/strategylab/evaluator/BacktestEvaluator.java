package com.strategylab.evaluator;

import com.strategylab.domain.model.DateRange;
import com.strategylab.domain.model.Element;
import com.strategylab.domain.model.RunMetrics;
import java.util.List;

/**
 * Runs one backtest of a fully resolved strategy tree. Implementations must be safe to
 * call from several threads at once.
 */
public interface BacktestEvaluator {

    /**
     * @param resolvedElements root elements with every variable token substituted
     * @param benchmarkSymbol  symbol the strategy is compared against
     * @param dateRange        backtest window
     * @return normalized metrics of the run
     * @throws com.strategylab.exception.EvaluatorException if the backtest could not be run
     */
    RunMetrics runBacktest(List<Element> resolvedElements, String benchmarkSymbol, DateRange dateRange);
}
