package com.strategylab.domain.model;

import com.strategylab.domain.enums.SortDirection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Ranks its children by an indicator and keeps the top or bottom {@code count}. */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class SortElement extends Element {

    private String name;

    @Builder.Default
    private SortDirection direction = SortDirection.TOP;

    private String count;
    private String indicator;
    private String period;
    private Map<String, String> params;

    @Builder.Default
    private List<Element> children = new ArrayList<>();
}
