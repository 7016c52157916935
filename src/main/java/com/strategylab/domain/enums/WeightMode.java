package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How a weight group splits its allocation across children. */
public enum WeightMode {
    @JsonProperty("equal")
    EQUAL,

    @JsonProperty("defined")
    DEFINED
}
