package com.strategylab.repository.jpa;

import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.entity.BatchJobEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the batch_jobs table.
 * On startup, BatchJobRecoveryService queries for jobs left queued or running.
 */
@Repository
public interface BatchJobJpaRepository extends JpaRepository<BatchJobEntity, String> {

    List<BatchJobEntity> findByStatusIn(List<BatchJobStatus> statuses);

    List<BatchJobEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<BatchJobEntity> findByStatusOrderByCreatedAtDesc(BatchJobStatus status, Pageable pageable);
}
