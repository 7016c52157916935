package com.strategylab.batch;

import com.strategylab.domain.model.StrategyDefinition;
import com.strategylab.domain.model.VariableList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of {@link BatchJobOrchestrator#create(BatchJobCommand)}.
 *
 * <p>{@code assignments} may be left empty; the orchestrator then enumerates them from
 * the variable lists with the configured cap. {@code truncated} is the client's claim
 * when it enumerated itself; null means "compute it".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobCommand {

    private String jobId;
    private String name;
    private StrategyDefinition strategy;
    private List<VariableList> variables;
    private List<Map<String, String>> assignments;
    private Boolean truncated;
}
