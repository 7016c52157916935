package com.strategylab.unit.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.strategylab.batch.BatchJobStore;
import com.strategylab.batch.BatchResultService;
import com.strategylab.config.BatchProperties;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.BatchJobView;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.domain.model.RunResult;
import com.strategylab.domain.model.VariableDetail;
import com.strategylab.exception.InvalidStateException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for BatchResultService covering the CSV layout, cell escaping and the
 * paginated view of a terminal job.
 */
@ExtendWith(MockitoExtension.class)
class BatchResultServiceTest {

    @Mock
    private BatchJobStore batchJobStore;

    private BatchProperties batchProperties;
    private BatchResultService service;

    @BeforeEach
    void setUp() {
        batchProperties = new BatchProperties();
        service = new BatchResultService(batchJobStore, batchProperties);
    }

    private static BatchJob finishedJob() {
        return BatchJob.builder()
                .id("job-1")
                .name("RSI sweep")
                .status(BatchJobStatus.FINISHED)
                .total(2)
                .completed(2)
                .detail(List.of(
                        VariableDetail.of("ticker", List.of("SPY", "QQQ")),
                        VariableDetail.of("period", List.of("14"))))
                .build();
    }

    private static Map<String, String> vars(String ticker, String period) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("ticker", ticker);
        vars.put("period", period);
        return vars;
    }

    @Nested
    @DisplayName("CSV export")
    class Csv {

        @Test
        @DisplayName("header is variables, sorted metrics, then error; failed rows leave metrics empty")
        void layout() throws Exception {
            RunResult ok = RunResult.builder()
                    .runIndex(0)
                    .variables(vars("SPY", "14"))
                    .metrics(RunMetrics.of(Map.of("totalReturn", 0.125, "sharpeRatio", 1.5)))
                    .build();
            RunResult failed = RunResult.builder()
                    .runIndex(1)
                    .variables(vars("QQQ", "14"))
                    .error("No data")
                    .build();
            when(batchJobStore.findAllRuns("job-1")).thenReturn(List.of(ok, failed));

            StringWriter out = new StringWriter();
            service.writeCsv(finishedJob(), out);

            assertThat(out.toString()).isEqualTo("""
                    ticker,period,sharpeRatio,totalReturn,error
                    SPY,14,1.5,0.125,
                    QQQ,14,,,No data
                    """);
        }

        @Test
        @DisplayName("cells with commas, quotes or newlines are quoted")
        void escaping() throws Exception {
            RunResult failed = RunResult.builder()
                    .runIndex(0)
                    .variables(vars("SPY", "14"))
                    .error("Bad \"period\", expected\nnumber")
                    .build();
            when(batchJobStore.findAllRuns("job-1")).thenReturn(List.of(failed));

            StringWriter out = new StringWriter();
            service.writeCsv(finishedJob(), out);

            assertThat(out.toString()).endsWith("SPY,14,\"Bad \"\"period\"\", expected\nnumber\"\n");
        }

        @Test
        @DisplayName("a job with no runs still gets a header")
        void headerOnly() throws Exception {
            when(batchJobStore.findAllRuns("job-1")).thenReturn(List.of());

            StringWriter out = new StringWriter();
            service.writeCsv(finishedJob(), out);

            assertThat(out.toString()).isEqualTo("ticker,period,error\n");
        }

        @Test
        @DisplayName("a running job cannot be exported")
        void runningRejected() {
            BatchJob running = finishedJob().toBuilder().status(BatchJobStatus.RUNNING).build();

            assertThatThrownBy(() -> service.writeCsv(running, new StringWriter()))
                    .isInstanceOf(InvalidStateException.class);
        }
    }

    @Nested
    @DisplayName("View")
    class View {

        @Test
        @DisplayName("page carries job context, run count and the requested slice")
        void page() {
            RunResult run = RunResult.builder().runIndex(5).variables(vars("SPY", "14")).build();
            when(batchJobStore.countRuns("job-1")).thenReturn(12L);
            when(batchJobStore.findRuns("job-1", 5L, 1)).thenReturn(List.of(run));

            BatchJobView view = service.getView(finishedJob(), 5, 1);

            assertThat(view.getJobId()).isEqualTo("job-1");
            assertThat(view.getStatus()).isEqualTo(BatchJobStatus.FINISHED);
            assertThat(view.getRunsTotal()).isEqualTo(12L);
            assertThat(view.getRuns()).containsExactly(run);
            assertThat(view.getDetail()).hasSize(2);
        }

        @Test
        @DisplayName("limit is clamped to the configured page size")
        void limitClamped() {
            batchProperties.setViewPageLimit(50);
            when(batchJobStore.findRuns(eq("job-1"), anyLong(), anyInt())).thenReturn(List.of());

            BatchJobView view = service.getView(finishedJob(), -3, 10_000);

            assertThat(view.getLimit()).isEqualTo(50);
            assertThat(view.getOffset()).isZero();
            verify(batchJobStore).findRuns("job-1", 0L, 50);
        }

        @Test
        @DisplayName("a queued job has no view yet")
        void queuedRejected() {
            BatchJob queued = finishedJob().toBuilder().status(BatchJobStatus.QUEUED).build();

            assertThatThrownBy(() -> service.getView(queued, 0, 10)).isInstanceOf(InvalidStateException.class);
        }
    }
}
