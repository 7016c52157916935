package com.strategylab.batch;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Output of {@link AssignmentGenerator#generate}: the enumerated assignments in
 * generation order and whether the enumeration stopped at the cap.
 */
@Value
public class AssignmentBatch {

    List<Map<String, String>> assignments;
    boolean truncated;

    public static AssignmentBatch empty() {
        return new AssignmentBatch(List.of(), false);
    }

    public int size() {
        return assignments.size();
    }
}
