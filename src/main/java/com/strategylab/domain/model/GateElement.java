package com.strategylab.domain.model;

import com.strategylab.domain.enums.ConditionMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** If/else node: allocates to {@code thenChildren} when its conditions hold, else to {@code elseChildren}. */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class GateElement extends Element {

    private String name;

    @Builder.Default
    private ConditionMode conditionMode = ConditionMode.IF;

    @Builder.Default
    private List<GateCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<Element> thenChildren = new ArrayList<>();

    @Builder.Default
    private List<Element> elseChildren = new ArrayList<>();
}
