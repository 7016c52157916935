package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SortDirection {
    @JsonProperty("top")
    TOP,

    @JsonProperty("bottom")
    BOTTOM
}
