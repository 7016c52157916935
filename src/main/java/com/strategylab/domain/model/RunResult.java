package com.strategylab.domain.model;

import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one assignment within a batch. Exactly one of {@code metrics} and
 * {@code error} is set. {@code runIndex} is the assignment's position in generation
 * order, so results stay associated with their assignment whatever order runs finish in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    private int runIndex;
    private Map<String, String> variables;
    private RunMetrics metrics;
    private String error;
    private Instant completedAt;

    public boolean isSuccessful() {
        return error == null;
    }
}
