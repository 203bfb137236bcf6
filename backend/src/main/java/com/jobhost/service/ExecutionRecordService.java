package com.jobhost.service;

import com.jobhost.dto.ExecutionRecordResponse;
import com.jobhost.dto.PageResponse;
import com.jobhost.exception.NotFoundException;
import com.jobhost.model.ExecutionRecord;
import com.jobhost.model.enums.ExecutionStatus;
import com.jobhost.repository.ExecutionRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ExecutionRecordService {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final ExecutionRecordRepository repository;

    @Transactional
    public ExecutionRecord open(UUID jobId, String fireInstanceId) {
        ExecutionRecord record = ExecutionRecord.builder()
                .jobId(jobId)
                .fireInstanceId(fireInstanceId)
                .status(ExecutionStatus.RUNNING)
                .startTime(LocalDateTime.now())
                .build();
        return repository.save(record);
    }

    /** Closes a running record. Closed records are immutable. */
    @Transactional
    public ExecutionRecord close(UUID recordId, ExecutionStatus status, String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        ExecutionRecord record = repository.findById(recordId)
                .orElseThrow(() -> new NotFoundException("Execution record not found: " + recordId));
        if (record.getStatus().isTerminal()) {
            throw new IllegalStateException("Execution record " + recordId + " is already closed as "
                    + record.getStatus());
        }
        record.setStatus(status);
        record.setEndTime(LocalDateTime.now());
        record.setErrorMessage(truncate(errorMessage));
        return repository.save(record);
    }

    @Transactional(readOnly = true)
    public PageResponse<ExecutionRecordResponse> findAll(UUID jobId, String status,
                                                         LocalDateTime from, LocalDateTime to,
                                                         Pageable pageable) {
        Specification<ExecutionRecord> spec = Specification.where(null);

        if (jobId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("jobId"), jobId));
        }
        if (status != null && !status.isBlank()) {
            ExecutionStatus es = ExecutionStatus.valueOf(status.toUpperCase());
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), es));
        }
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("startTime"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("startTime"), to));
        }

        Page<ExecutionRecord> page = repository.findAll(spec, pageable);
        return PageResponse.from(page, ExecutionRecordResponse::from);
    }

    @Transactional(readOnly = true)
    public PageResponse<ExecutionRecordResponse> findByJob(UUID jobId, Pageable pageable) {
        return PageResponse.from(repository.findByJobId(jobId, pageable), ExecutionRecordResponse::from);
    }

    @Transactional(readOnly = true)
    public ExecutionRecordResponse findById(UUID id) {
        return repository.findById(id)
                .map(ExecutionRecordResponse::from)
                .orElseThrow(() -> new NotFoundException("Execution record not found: " + id));
    }

    @Transactional(readOnly = true)
    public long countByStatus(ExecutionStatus status) {
        return repository.countByStatus(status);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
