package com.strategylab.entity;

import com.strategylab.domain.enums.BatchJobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the batch_jobs table.
 * One row per batch sweep. Besides the progress fields it stores the inputs needed to
 * resume the sweep after a restart: the base strategy and the full assignment list.
 */
@Entity
@Table(name = "batch_jobs", indexes = @Index(name = "idx_batch_jobs_status", columnList = "status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchJobEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private BatchJobStatus status;

    private int total;

    private int completed;

    @Column(name = "failed_runs")
    private int failedRuns;

    private boolean truncated;

    /** JSON array of VariableDetail. */
    @Lob
    private String detail;

    /** JSON of the StrategyDefinition every run is derived from. */
    @Lob
    @Column(name = "strategy")
    private String strategy;

    /** JSON array of assignments in generation order; run_index points into it. */
    @Lob
    private String assignments;

    @Column(name = "benchmark_symbol", length = 20)
    private String benchmarkSymbol;

    @Column(name = "start_date", length = 10)
    private String startDate;

    @Column(name = "end_date", length = 10)
    private String endDate;

    /** JSON of BatchJobSummary; null until the job finishes. */
    @Lob
    private String summary;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "view_ref")
    private String viewRef;

    @Column(name = "csv_ref")
    private String csvRef;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;
}
