package com.strategylab.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the batch_job_runs table.
 * One row per executed assignment, written as soon as the run finishes so partial
 * results survive a restart. (batch_job_id, run_index) is unique.
 */
@Entity
@Table(
        name = "batch_job_runs",
        uniqueConstraints = @UniqueConstraint(name = "uk_batch_job_run", columnNames = {"batch_job_id", "run_index"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchJobRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_job_id", length = 64, nullable = false)
    private String batchJobId;

    @Column(name = "run_index", nullable = false)
    private int runIndex;

    /** JSON object: variable name -> bound value. */
    @Lob
    private String variables;

    /** JSON object: metric name -> value. Null for failed runs. */
    @Lob
    private String metrics;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "completed_at")
    private Instant completedAt;
}
