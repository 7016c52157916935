package com.strategylab.api.controller;

import com.strategylab.api.dto.request.CreateBatchJobRequest;
import com.strategylab.api.dto.response.BatchJobResponse;
import com.strategylab.batch.BatchJobOrchestrator;
import com.strategylab.batch.BatchResultService;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.exception.ValidationException;
import com.strategylab.mapper.BatchJobDtoMapper;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for batch backtest jobs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/batch-jobs                   - Submit a sweep (202 + initial snapshot)</li>
 *   <li>GET  /api/batch-jobs                   - Recent jobs, optionally by status</li>
 *   <li>GET  /api/batch-jobs/{id}              - Current snapshot, polled by clients</li>
 *   <li>POST /api/batch-jobs/{id}/cancel       - Request cancellation (409 if terminal)</li>
 *   <li>GET  /api/batch-jobs/{id}/view         - Paginated results (202 while running)</li>
 *   <li>GET  /api/batch-jobs/{id}/results.csv  - CSV export (202 while running)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/batch-jobs")
@RequiredArgsConstructor
public class BatchJobController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final BatchJobOrchestrator batchJobOrchestrator;
    private final BatchResultService batchResultService;
    private final BatchJobDtoMapper batchJobDtoMapper;

    @PostMapping
    public ResponseEntity<BatchJobResponse> create(@Valid @RequestBody CreateBatchJobRequest request) {
        BatchJob job = batchJobOrchestrator.create(batchJobDtoMapper.toCommand(request));
        return ResponseEntity.accepted().body(batchJobDtoMapper.toResponse(job));
    }

    @GetMapping
    public ResponseEntity<List<BatchJobResponse>> list(
            @RequestParam(required = false) String status, @RequestParam(defaultValue = "50") int limit) {
        BatchJobStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = BatchJobStatus.fromValue(status);
            if (filter == null) {
                throw new ValidationException("Unknown status: " + status, Map.of("status", status));
            }
        }
        return ResponseEntity.ok(batchJobDtoMapper.toResponseList(batchJobOrchestrator.list(filter, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BatchJobResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(batchJobDtoMapper.toResponse(batchJobOrchestrator.get(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BatchJobResponse> cancel(@PathVariable String id) {
        return ResponseEntity.ok(batchJobDtoMapper.toResponse(batchJobOrchestrator.cancel(id)));
    }

    /**
     * Results page. Answers 202 with the current status while the job is still queued or
     * running.
     */
    @GetMapping("/{id}/view")
    public ResponseEntity<?> view(
            @PathVariable String id,
            @RequestParam(defaultValue = "0") long offset,
            @RequestParam(defaultValue = "1000") int limit) {
        BatchJob job = batchJobOrchestrator.get(id);
        if (!job.isTerminal()) {
            return stillRunning(job);
        }
        return ResponseEntity.ok(batchJobDtoMapper.toViewResponse(batchResultService.getView(job, offset, limit)));
    }

    @GetMapping("/{id}/results.csv")
    public ResponseEntity<?> resultsCsv(@PathVariable String id) {
        BatchJob job = batchJobOrchestrator.get(id);
        if (!job.isTerminal()) {
            return stillRunning(job);
        }
        StringWriter writer = new StringWriter();
        try {
            batchResultService.writeCsv(job, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"batch-" + job.getId() + ".csv\"")
                .body(writer.toString());
    }

    private static ResponseEntity<Map<String, String>> stillRunning(BatchJob job) {
        return ResponseEntity.accepted()
                .body(Map.of("status", job.getStatus().getValue(), "message", "Batch still running"));
    }
}
