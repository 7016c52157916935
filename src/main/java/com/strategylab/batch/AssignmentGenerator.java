package com.strategylab.batch;

import com.strategylab.domain.model.VariableDetail;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Enumerates the cartesian product of variable values as a list of assignments.
 *
 * <p>Order is a depth-first walk over the detail entries in order, and over each
 * entry's values in order: the last variable varies fastest. Enumeration stops as soon
 * as {@code cap} assignments exist, so the full product is never materialized.
 *
 * <p>A detail entry without values makes the whole product empty.
 * {@link #estimateTotal(List)} still counts such an entry as 1, so the display total
 * and the generated count can differ; batch creation rejects empty lists up front.
 */
@Component
public class AssignmentGenerator {

    public AssignmentBatch generate(List<VariableDetail> detail, int cap) {
        if (detail == null || detail.isEmpty()) {
            return AssignmentBatch.empty();
        }
        for (VariableDetail entry : detail) {
            if (valuesOf(entry).isEmpty()) {
                return AssignmentBatch.empty();
            }
        }
        if (cap <= 0) {
            // Nothing fits, and every entry has values, so the product is non-empty.
            return new AssignmentBatch(List.of(), productSize(detail).signum() > 0);
        }

        List<Map<String, String>> out = new ArrayList<>(Math.min(cap, 1024));
        boolean complete = walk(detail, 0, new LinkedHashMap<>(), out, cap);
        boolean truncated = !complete && productSize(detail).compareTo(BigInteger.valueOf(cap)) > 0;
        return new AssignmentBatch(Collections.unmodifiableList(out), truncated);
    }

    /**
     * Returns false when the cap stopped the walk before every combination was visited.
     */
    private boolean walk(
            List<VariableDetail> detail,
            int index,
            LinkedHashMap<String, String> current,
            List<Map<String, String>> out,
            int cap) {
        if (index == detail.size()) {
            if (out.size() >= cap) {
                return false;
            }
            out.add(Collections.unmodifiableMap(new LinkedHashMap<>(current)));
            return true;
        }
        VariableDetail entry = detail.get(index);
        for (String value : valuesOf(entry)) {
            current.put(entry.getName(), value);
            if (!walk(detail, index + 1, current, out, cap)) {
                current.remove(entry.getName());
                return false;
            }
        }
        current.remove(entry.getName());
        return true;
    }

    /**
     * Human-readable estimate {@code Π max(count, 1)}, saturating at {@link Long#MAX_VALUE}.
     * Returns 0 for an empty detail list.
     */
    public long estimateTotal(List<VariableDetail> detail) {
        if (detail == null || detail.isEmpty()) {
            return 0L;
        }
        long total = 1L;
        for (VariableDetail entry : detail) {
            int count = Math.max(valuesOf(entry).size(), 1);
            if (total > Long.MAX_VALUE / count) {
                return Long.MAX_VALUE;
            }
            total *= count;
        }
        return total;
    }

    /** Exact size of the cartesian product; zero if any entry has no values. */
    public BigInteger productSize(List<VariableDetail> detail) {
        if (detail == null || detail.isEmpty()) {
            return BigInteger.ZERO;
        }
        BigInteger product = BigInteger.ONE;
        for (VariableDetail entry : detail) {
            product = product.multiply(BigInteger.valueOf(valuesOf(entry).size()));
        }
        return product;
    }

    private static List<String> valuesOf(VariableDetail entry) {
        return entry.getValues() != null ? entry.getValues() : List.of();
    }
}
