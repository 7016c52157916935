package com.strategylab.domain.model;

import com.strategylab.domain.enums.VariableType;
import com.strategylab.variable.VariableTokens;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * A named, ordered set of candidate values for one variable.
 *
 * <p>Names are stored without the leading {@code $} and in lower case, so
 * {@code $RSI_Period} and {@code rsi_period} refer to the same list. Values keep their
 * first-seen order and appear once.
 */
@Value
@Builder
public class VariableList {

    String name;

    /** Null when the list came from a batch request, which carries only names and values. */
    VariableType type;

    List<String> values;

    /**
     * Builds a list with a normalized name and de-duplicated values. When {@code type}
     * is given, values are normalized for that type and invalid ones are dropped.
     */
    public static VariableList of(String name, VariableType type, Collection<String> rawValues) {
        Set<String> distinct = new LinkedHashSet<>();
        if (rawValues != null) {
            for (String raw : rawValues) {
                if (raw == null) {
                    continue;
                }
                Optional<String> normalized = type != null ? type.normalizeValue(raw) : Optional.of(raw.trim());
                normalized.filter(v -> !v.isEmpty()).ifPresent(distinct::add);
            }
        }
        return VariableList.builder()
                .name(VariableTokens.normalizeName(name))
                .type(type)
                .values(List.copyOf(new ArrayList<>(distinct)))
                .build();
    }
}
