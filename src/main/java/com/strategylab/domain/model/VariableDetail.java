package com.strategylab.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One variable referenced by a batch: its name, the values swept over, and how many
 * there are. {@code count} always equals {@code values.size()} when built through
 * {@link #of(String, List)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableDetail {

    private String name;
    private int count;
    private List<String> values;

    /** Optional display label (e.g. the original mixed-case name). */
    private String label;

    public static VariableDetail of(String name, List<String> values) {
        List<String> copy = values != null ? List.copyOf(values) : List.of();
        return VariableDetail.builder()
                .name(name)
                .count(copy.size())
                .values(copy)
                .build();
    }
}
