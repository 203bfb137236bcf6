package com.jobhost.repository;

import com.jobhost.model.ExecutionRecord;
import com.jobhost.model.enums.ExecutionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;
import java.util.UUID;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, UUID>,
        JpaSpecificationExecutor<ExecutionRecord> {

    Page<ExecutionRecord> findByJobId(UUID jobId, Pageable pageable);

    Optional<ExecutionRecord> findByFireInstanceId(String fireInstanceId);

    long countByStatus(ExecutionStatus status);
}
