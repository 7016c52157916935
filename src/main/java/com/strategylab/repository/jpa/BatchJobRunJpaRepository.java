package com.strategylab.repository.jpa;

import com.strategylab.entity.BatchJobRunEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** JPA repository for the batch_job_runs table. */
@Repository
public interface BatchJobRunJpaRepository extends JpaRepository<BatchJobRunEntity, Long> {

    List<BatchJobRunEntity> findByBatchJobIdOrderByRunIndexAsc(String batchJobId);

    List<BatchJobRunEntity> findByBatchJobIdOrderByRunIndexAsc(String batchJobId, Pageable pageable);

    long countByBatchJobId(String batchJobId);

    @Query("select r.runIndex from BatchJobRunEntity r where r.batchJobId = :jobId")
    List<Integer> findRunIndexesByBatchJobId(@Param("jobId") String jobId);
}
