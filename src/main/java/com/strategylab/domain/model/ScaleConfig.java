package com.strategylab.domain.model;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Indicator reading and the range over which a scale node blends its two branches. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScaleConfig {

    private String ticker;
    private String indicator;
    private String period;
    private Map<String, String> params;
    private String rangeMin;
    private String rangeMax;
}
