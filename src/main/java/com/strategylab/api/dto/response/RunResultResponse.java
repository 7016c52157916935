package com.strategylab.api.dto.response;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** One row of a batch result view. */
@Getter
@Builder
public class RunResultResponse {

    private final int runIndex;
    private final Map<String, String> variables;
    private final Map<String, Double> metrics;
    private final String error;
}
