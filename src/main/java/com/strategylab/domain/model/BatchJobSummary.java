package com.strategylab.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate of total returns over the successful runs of a job. Failed runs are only
 * counted. With no successful run the return fields are 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobSummary {

    private int totalRuns;
    private int successfulRuns;
    private int failedRuns;
    private double bestTotalReturn;
    private double worstTotalReturn;

    /** Mean rounded to 4 decimal places. */
    private double avgTotalReturn;

    public static BatchJobSummary empty() {
        return BatchJobSummary.builder().build();
    }

    public static BatchJobSummary of(Collection<RunResult> runs) {
        int successful = 0;
        int failed = 0;
        double sum = 0.0;
        double best = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        for (RunResult run : runs) {
            if (!run.isSuccessful() || run.getMetrics() == null) {
                failed++;
                continue;
            }
            Double totalReturn = run.getMetrics().getTotalReturn();
            double value = totalReturn != null ? totalReturn : 0.0;
            successful++;
            sum += value;
            best = Math.max(best, value);
            worst = Math.min(worst, value);
        }
        if (successful == 0) {
            return BatchJobSummary.builder().totalRuns(failed).failedRuns(failed).build();
        }
        return BatchJobSummary.builder()
                .totalRuns(successful + failed)
                .successfulRuns(successful)
                .failedRuns(failed)
                .bestTotalReturn(round4(best))
                .worstTotalReturn(round4(worst))
                .avgTotalReturn(round4(sum / successful))
                .build();
    }

    private static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
