package com.strategylab.variable;

import com.strategylab.domain.model.Element;
import com.strategylab.domain.model.GateCondition;
import com.strategylab.domain.model.GateElement;
import com.strategylab.domain.model.ScaleConfig;
import com.strategylab.domain.model.ScaleElement;
import com.strategylab.domain.model.SortElement;
import com.strategylab.domain.model.TickerElement;
import com.strategylab.domain.model.VariableDetail;
import com.strategylab.domain.model.VariableList;
import com.strategylab.domain.model.WeightElement;
import com.strategylab.exception.ValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Finds, checks and binds the variable tokens of a strategy tree.
 *
 * <p>Every operation goes through {@link #rewrite(Element, FieldMapper)}, the single place
 * that lists which fields of each element variant accept tokens and of what
 * {@link FieldKind}. Extraction and substitution therefore always agree on the field set.
 *
 * <p>All operations are pure: inputs are never modified, substitution returns a deep copy.
 */
@Component
public class VariableResolver {

    /** Normalized names of all variables referenced anywhere in the trees, in first-seen order. */
    public Set<String> extractVariables(List<Element> elements) {
        Set<String> found = new LinkedHashSet<>();
        FieldMapper collector = (kind, value) -> {
            if (VariableTokens.isToken(value)) {
                found.add(VariableTokens.normalizeName(value));
            }
            return value;
        };
        rewriteAll(elements, collector);
        return found;
    }

    /** Names of referenced variables with no matching list (case-insensitive), sorted. */
    public Set<String> validateBindings(List<Element> elements, Collection<VariableList> knownLists) {
        Set<String> known = new HashSet<>();
        for (VariableList list : knownLists) {
            known.add(VariableTokens.normalizeName(list.getName()));
        }
        Set<String> missing = new TreeSet<>(extractVariables(elements));
        missing.removeAll(known);
        return missing;
    }

    /**
     * Throws {@link ValidationException} listing every unbound variable, or returns
     * normally when all referenced variables have a list.
     */
    public void requireBindings(List<Element> elements, Collection<VariableList> knownLists) {
        Set<String> missing = validateBindings(elements, knownLists);
        if (!missing.isEmpty()) {
            throw ValidationException.missingVariables(missing);
        }
    }

    /**
     * One detail entry per referenced variable, ordered by first appearance in the tree,
     * with values taken from the matching list.
     *
     * @throws ValidationException if a referenced variable has no list
     */
    public List<VariableDetail> buildDetail(List<Element> elements, Collection<VariableList> knownLists) {
        requireBindings(elements, knownLists);
        Map<String, VariableList> byName = new HashMap<>();
        for (VariableList list : knownLists) {
            byName.putIfAbsent(VariableTokens.normalizeName(list.getName()), list);
        }
        List<VariableDetail> detail = new ArrayList<>();
        for (String name : extractVariables(elements)) {
            detail.add(VariableDetail.of(name, byName.get(name).getValues()));
        }
        return detail;
    }

    /** Substitutes {@code assignment} into a single tree. See {@link #substituteAll(List, Map)}. */
    public Element substitute(Element element, Map<String, String> assignment) {
        return rewrite(element, binder(assignment));
    }

    /**
     * Returns a deep copy of the trees with every bound token replaced by its value.
     * Ticker fields receive the upper-cased value, numeric fields the parsed number in
     * plain notation, text fields the value as given. Unbound tokens are left in place.
     *
     * @throws ValidationException if a value bound into a numeric field is not a number
     */
    public List<Element> substituteAll(List<Element> elements, Map<String, String> assignment) {
        return rewriteAll(elements, binder(assignment));
    }

    private FieldMapper binder(Map<String, String> assignment) {
        Map<String, String> normalized = new HashMap<>();
        assignment.forEach((name, value) -> normalized.put(VariableTokens.normalizeName(name), value));
        return (kind, value) -> {
            if (!VariableTokens.isToken(value)) {
                return value;
            }
            String bound = normalized.get(VariableTokens.normalizeName(value));
            return bound != null ? coerce(kind, bound, value.trim()) : value;
        };
    }

    private static String coerce(FieldKind kind, String bound, String token) {
        String trimmed = bound.trim();
        switch (kind) {
            case TICKER:
                return trimmed.toUpperCase(Locale.ROOT);
            case NUMBER:
                try {
                    return new BigDecimal(trimmed).stripTrailingZeros().toPlainString();
                } catch (NumberFormatException e) {
                    throw new ValidationException(
                            "Value '" + bound + "' bound to " + token + " is not a number",
                            Map.of("variable", VariableTokens.normalizeName(token), "value", bound));
                }
            default:
                return bound;
        }
    }

    // ---- Tree walk ----

    @FunctionalInterface
    interface FieldMapper {
        String map(FieldKind kind, String value);
    }

    private List<Element> rewriteAll(List<Element> elements, FieldMapper mapper) {
        if (elements == null) {
            return new ArrayList<>();
        }
        List<Element> out = new ArrayList<>(elements.size());
        for (Element element : elements) {
            out.add(rewrite(element, mapper));
        }
        return out;
    }

    private Element rewrite(Element element, FieldMapper mapper) {
        if (element == null) {
            return null;
        }
        if (element instanceof TickerElement ticker) {
            return ticker.toBuilder()
                    .ticker(mapper.map(FieldKind.TICKER, ticker.getTicker()))
                    .weight(mapper.map(FieldKind.NUMBER, ticker.getWeight()))
                    .build();
        }
        if (element instanceof WeightElement group) {
            return group.toBuilder()
                    .name(mapper.map(FieldKind.TEXT, group.getName()))
                    .weight(mapper.map(FieldKind.NUMBER, group.getWeight()))
                    .children(rewriteAll(group.getChildren(), mapper))
                    .build();
        }
        if (element instanceof GateElement gate) {
            List<GateCondition> conditions = new ArrayList<>();
            if (gate.getConditions() != null) {
                for (GateCondition condition : gate.getConditions()) {
                    conditions.add(rewriteCondition(condition, mapper));
                }
            }
            return gate.toBuilder()
                    .name(mapper.map(FieldKind.TEXT, gate.getName()))
                    .weight(mapper.map(FieldKind.NUMBER, gate.getWeight()))
                    .conditions(conditions)
                    .thenChildren(rewriteAll(gate.getThenChildren(), mapper))
                    .elseChildren(rewriteAll(gate.getElseChildren(), mapper))
                    .build();
        }
        if (element instanceof ScaleElement scale) {
            return scale.toBuilder()
                    .name(mapper.map(FieldKind.TEXT, scale.getName()))
                    .weight(mapper.map(FieldKind.NUMBER, scale.getWeight()))
                    .config(rewriteScaleConfig(scale.getConfig(), mapper))
                    .fromChildren(rewriteAll(scale.getFromChildren(), mapper))
                    .toChildren(rewriteAll(scale.getToChildren(), mapper))
                    .build();
        }
        if (element instanceof SortElement sort) {
            return sort.toBuilder()
                    .name(mapper.map(FieldKind.TEXT, sort.getName()))
                    .weight(mapper.map(FieldKind.NUMBER, sort.getWeight()))
                    .count(mapper.map(FieldKind.NUMBER, sort.getCount()))
                    .indicator(mapper.map(FieldKind.TEXT, sort.getIndicator()))
                    .period(mapper.map(FieldKind.NUMBER, sort.getPeriod()))
                    .params(rewriteParams(sort.getParams(), mapper))
                    .children(rewriteAll(sort.getChildren(), mapper))
                    .build();
        }
        throw new IllegalArgumentException(
                "Unsupported element type: " + element.getClass().getSimpleName());
    }

    private GateCondition rewriteCondition(GateCondition condition, FieldMapper mapper) {
        if (condition == null) {
            return null;
        }
        return condition.toBuilder()
                .ticker(mapper.map(FieldKind.TICKER, condition.getTicker()))
                .indicator(mapper.map(FieldKind.TEXT, condition.getIndicator()))
                .period(mapper.map(FieldKind.NUMBER, condition.getPeriod()))
                .params(rewriteParams(condition.getParams(), mapper))
                .threshold(mapper.map(FieldKind.NUMBER, condition.getThreshold()))
                .rightTicker(mapper.map(FieldKind.TICKER, condition.getRightTicker()))
                .rightIndicator(mapper.map(FieldKind.TEXT, condition.getRightIndicator()))
                .rightPeriod(mapper.map(FieldKind.NUMBER, condition.getRightPeriod()))
                .rightParams(rewriteParams(condition.getRightParams(), mapper))
                .build();
    }

    private ScaleConfig rewriteScaleConfig(ScaleConfig config, FieldMapper mapper) {
        if (config == null) {
            return null;
        }
        return config.toBuilder()
                .ticker(mapper.map(FieldKind.TICKER, config.getTicker()))
                .indicator(mapper.map(FieldKind.TEXT, config.getIndicator()))
                .period(mapper.map(FieldKind.NUMBER, config.getPeriod()))
                .params(rewriteParams(config.getParams(), mapper))
                .rangeMin(mapper.map(FieldKind.NUMBER, config.getRangeMin()))
                .rangeMax(mapper.map(FieldKind.NUMBER, config.getRangeMax()))
                .build();
    }

    private Map<String, String> rewriteParams(Map<String, String> params, FieldMapper mapper) {
        if (params == null) {
            return null;
        }
        Map<String, String> out = new LinkedHashMap<>();
        params.forEach((key, value) -> out.put(key, mapper.map(FieldKind.TEXT, value)));
        return out;
    }
}
