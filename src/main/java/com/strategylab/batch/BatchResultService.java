package com.strategylab.batch;

import com.strategylab.config.BatchProperties;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.BatchJobView;
import com.strategylab.domain.model.RunResult;
import com.strategylab.domain.model.VariableDetail;
import com.strategylab.exception.InvalidStateException;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

/**
 * Reads the result artifact of a terminal batch job: a paginated view of the runs and a
 * CSV export of all of them. Both come from the database, so they stay available after
 * the job has left memory.
 */
@Service
public class BatchResultService {

    static final String ERROR_COLUMN = "error";

    private final BatchJobStore batchJobStore;
    private final BatchProperties batchProperties;

    public BatchResultService(BatchJobStore batchJobStore, BatchProperties batchProperties) {
        this.batchJobStore = batchJobStore;
        this.batchProperties = batchProperties;
    }

    /**
     * Runs ordered by run index, starting at {@code offset}. {@code limit} is clamped to
     * {@code [1, strategylab.batch.view-page-limit]}.
     *
     * @throws InvalidStateException if the job is not terminal yet
     */
    public BatchJobView getView(BatchJob job, long offset, int limit) {
        requireTerminal(job);
        long boundedOffset = Math.max(0, offset);
        int boundedLimit = Math.max(1, Math.min(limit, batchProperties.getViewPageLimit()));
        return BatchJobView.builder()
                .jobId(job.getId())
                .name(job.getName())
                .status(job.getStatus())
                .summary(job.getSummary())
                .total(job.getTotal())
                .completed(job.getCompleted())
                .truncated(job.isTruncated())
                .error(job.getError())
                .detail(job.getDetail())
                .runsTotal(batchJobStore.countRuns(job.getId()))
                .offset(boundedOffset)
                .limit(boundedLimit)
                .runs(batchJobStore.findRuns(job.getId(), boundedOffset, boundedLimit))
                .build();
    }

    /**
     * Writes every run as CSV. Columns: the variables in detail order, the metric names
     * seen in any run in sorted order, then {@code error}.
     *
     * @throws InvalidStateException if the job is not terminal yet
     */
    public void writeCsv(BatchJob job, Writer writer) throws IOException {
        requireTerminal(job);
        List<RunResult> runs = batchJobStore.findAllRuns(job.getId());

        List<String> variableNames = new ArrayList<>();
        if (job.getDetail() != null) {
            for (VariableDetail entry : job.getDetail()) {
                variableNames.add(entry.getName());
            }
        }
        TreeSet<String> metricNames = new TreeSet<>();
        for (RunResult run : runs) {
            if (run.getMetrics() != null) {
                metricNames.addAll(run.getMetrics().toMap().keySet());
            }
        }

        List<String> header = new ArrayList<>(variableNames);
        header.addAll(metricNames);
        header.add(ERROR_COLUMN);
        writeRow(writer, header);

        for (RunResult run : runs) {
            List<String> row = new ArrayList<>(header.size());
            Map<String, String> variables = run.getVariables() != null ? run.getVariables() : Map.of();
            for (String name : variableNames) {
                row.add(variables.getOrDefault(name, ""));
            }
            for (String metric : metricNames) {
                Double value = run.getMetrics() != null ? run.getMetrics().get(metric) : null;
                row.add(value != null ? formatNumber(value) : "");
            }
            row.add(run.getError() != null ? run.getError() : "");
            writeRow(writer, row);
        }
        writer.flush();
    }

    private static void requireTerminal(BatchJob job) {
        if (!job.isTerminal()) {
            throw new InvalidStateException(
                    "Batch job " + job.getId() + " is still " + job.getStatus().getValue(),
                    Map.of("status", job.getStatus().getValue()));
        }
    }

    private static void writeRow(Writer writer, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(values.get(i)));
        }
        writer.write('\n');
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
