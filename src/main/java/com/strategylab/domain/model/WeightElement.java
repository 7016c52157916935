package com.strategylab.domain.model;

import com.strategylab.domain.enums.WeightMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class WeightElement extends Element {

    private String name;

    @Builder.Default
    private WeightMode weightMode = WeightMode.EQUAL;

    @Builder.Default
    private List<Element> children = new ArrayList<>();
}
