package com.strategylab.domain.model;

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
public class ScaleElement extends Element {

    private String name;
    private ScaleConfig config;

    @Builder.Default
    private List<Element> fromChildren = new ArrayList<>();

    @Builder.Default
    private List<Element> toChildren = new ArrayList<>();
}
