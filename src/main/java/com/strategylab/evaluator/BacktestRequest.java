package com.strategylab.evaluator;

import com.strategylab.domain.model.Element;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request body of the single-run backtest endpoint. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    private List<Element> elements;
    private String benchmarkSymbol;
    private String startDate;
    private String endDate;
    private boolean debug;
}
