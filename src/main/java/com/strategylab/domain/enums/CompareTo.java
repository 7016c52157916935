package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Right-hand side of a gate condition: a fixed threshold or another indicator. */
public enum CompareTo {
    @JsonProperty("threshold")
    THRESHOLD,

    @JsonProperty("indicator")
    INDICATOR
}
