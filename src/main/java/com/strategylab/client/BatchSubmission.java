package com.strategylab.client;

import com.strategylab.domain.model.StrategyDefinition;
import com.strategylab.domain.model.VariableList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** What a client submits: a base strategy, the variable lists it may reference and an optional name. */
@Value
@Builder
public class BatchSubmission {

    StrategyDefinition strategy;
    List<VariableList> variables;
    String jobName;
}
