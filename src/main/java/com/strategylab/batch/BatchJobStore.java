package com.strategylab.batch;

import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.RunResult;
import com.strategylab.domain.model.StrategyDefinition;
import com.strategylab.entity.BatchJobEntity;
import com.strategylab.entity.BatchJobRunEntity;
import com.strategylab.mapper.BatchJobMapper;
import com.strategylab.mapper.BatchJobRunMapper;
import com.strategylab.repository.jpa.BatchJobJpaRepository;
import com.strategylab.repository.jpa.BatchJobRunJpaRepository;
import com.strategylab.repository.jpa.OffsetPageRequest;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable store of batch jobs and their runs. The database is authoritative: in-memory
 * snapshots may be evicted at any time and are rebuilt from here.
 */
@Service
public class BatchJobStore {

    private final BatchJobJpaRepository batchJobJpaRepository;
    private final BatchJobRunJpaRepository batchJobRunJpaRepository;
    private final BatchJobMapper batchJobMapper;
    private final BatchJobRunMapper batchJobRunMapper;

    public BatchJobStore(
            BatchJobJpaRepository batchJobJpaRepository,
            BatchJobRunJpaRepository batchJobRunJpaRepository,
            BatchJobMapper batchJobMapper,
            BatchJobRunMapper batchJobRunMapper) {
        this.batchJobJpaRepository = batchJobJpaRepository;
        this.batchJobRunJpaRepository = batchJobRunJpaRepository;
        this.batchJobMapper = batchJobMapper;
        this.batchJobRunMapper = batchJobRunMapper;
    }

    /** Persists a new job with the inputs needed to (re)run it. */
    @Transactional
    public void insert(BatchJob job, StrategyDefinition strategy, List<Map<String, String>> assignments) {
        BatchJobEntity entity = batchJobMapper.toEntity(job);
        entity.setStrategy(batchJobMapper.strategyToJson(strategy));
        entity.setAssignments(batchJobMapper.assignmentsToJson(assignments));
        batchJobJpaRepository.save(entity);
    }

    /** Writes the progress fields of a snapshot over the stored row. */
    @Transactional
    public void update(BatchJob job) {
        BatchJobEntity entity = batchJobJpaRepository
                .findById(job.getId())
                .orElseThrow(() -> new IllegalStateException("Batch job row missing: " + job.getId()));
        batchJobMapper.updateEntity(job, entity);
        batchJobJpaRepository.save(entity);
    }

    /** Stores one finished run together with the job progress it produced. */
    @Transactional
    public void saveRun(BatchJob job, RunResult run) {
        BatchJobRunEntity entity = batchJobRunMapper.toEntity(run);
        entity.setBatchJobId(job.getId());
        batchJobRunJpaRepository.save(entity);
        update(job);
    }

    @Transactional(readOnly = true)
    public boolean exists(String jobId) {
        return batchJobJpaRepository.existsById(jobId);
    }

    @Transactional(readOnly = true)
    public Optional<BatchJob> find(String jobId) {
        return batchJobJpaRepository.findById(jobId).map(batchJobMapper::toDomain);
    }

    /** Most recent jobs first, optionally restricted to one status. */
    @Transactional(readOnly = true)
    public List<BatchJob> list(BatchJobStatus status, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<BatchJobEntity> entities = status != null
                ? batchJobJpaRepository.findByStatusOrderByCreatedAtDesc(status, page)
                : batchJobJpaRepository.findAllByOrderByCreatedAtDesc(page);
        return batchJobMapper.toDomainList(entities);
    }

    @Transactional(readOnly = true)
    public List<BatchJob> findUnfinished() {
        return batchJobMapper.toDomainList(
                batchJobJpaRepository.findByStatusIn(List.of(BatchJobStatus.QUEUED, BatchJobStatus.RUNNING)));
    }

    @Transactional(readOnly = true)
    public StrategyDefinition loadStrategy(String jobId) {
        return batchJobJpaRepository
                .findById(jobId)
                .map(entity -> batchJobMapper.jsonToStrategy(entity.getStrategy()))
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public List<Map<String, String>> loadAssignments(String jobId) {
        return batchJobJpaRepository
                .findById(jobId)
                .map(entity -> batchJobMapper.jsonToAssignments(entity.getAssignments()))
                .orElse(List.of());
    }

    @Transactional(readOnly = true)
    public List<RunResult> findRuns(String jobId, long offset, int limit) {
        return batchJobRunMapper.toDomainList(
                batchJobRunJpaRepository.findByBatchJobIdOrderByRunIndexAsc(jobId, OffsetPageRequest.of(offset, limit)));
    }

    @Transactional(readOnly = true)
    public List<RunResult> findAllRuns(String jobId) {
        return batchJobRunMapper.toDomainList(batchJobRunJpaRepository.findByBatchJobIdOrderByRunIndexAsc(jobId));
    }

    @Transactional(readOnly = true)
    public long countRuns(String jobId) {
        return batchJobRunJpaRepository.countByBatchJobId(jobId);
    }

    @Transactional(readOnly = true)
    public Set<Integer> findRunIndexes(String jobId) {
        return new HashSet<>(batchJobRunJpaRepository.findRunIndexesByBatchJobId(jobId));
    }
}
