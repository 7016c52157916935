package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ComparisonOperator {
    @JsonProperty("gt")
    GT,

    @JsonProperty("lt")
    LT
}
