package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConditionMode {
    @JsonProperty("if")
    IF,

    @JsonProperty("if_all")
    IF_ALL,

    @JsonProperty("if_any")
    IF_ANY,

    @JsonProperty("if_none")
    IF_NONE
}
