package com.jobhost.controller;

import com.jobhost.dto.ExecutionRecordResponse;
import com.jobhost.dto.ExecutionStatsResponse;
import com.jobhost.dto.PageResponse;
import com.jobhost.model.enums.ExecutionStatus;
import com.jobhost.service.ExecutionRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionRecordController {

    private static final Set<String> ALLOWED_SORT_FIELDS = Set.of("startTime", "endTime", "status");
    private static final int MAX_PAGE_SIZE = 100;

    private final ExecutionRecordService recordService;

    @GetMapping("/stats")
    public ExecutionStatsResponse getStats() {
        return ExecutionStatsResponse.builder()
                .runningCount(recordService.countByStatus(ExecutionStatus.RUNNING))
                .successCount(recordService.countByStatus(ExecutionStatus.SUCCESS))
                .failedCount(recordService.countByStatus(ExecutionStatus.FAILED))
                .cancelledCount(recordService.countByStatus(ExecutionStatus.CANCELLED))
                .build();
    }

    @GetMapping
    public PageResponse<ExecutionRecordResponse> findAll(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) UUID jobId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) LocalDateTime from,
            @RequestParam(required = false) LocalDateTime to,
            @RequestParam(defaultValue = "startTime") String sortBy,
            @RequestParam(defaultValue = "desc") String sortDir) {
        if (!ALLOWED_SORT_FIELDS.contains(sortBy)) sortBy = "startTime";
        if (size < 1) size = 20;
        if (size > MAX_PAGE_SIZE) size = MAX_PAGE_SIZE;
        if (page < 0) page = 0;
        Sort sort = sortDir.equalsIgnoreCase("asc")
                ? Sort.by(sortBy).ascending()
                : Sort.by(sortBy).descending();
        return recordService.findAll(jobId, status, from, to, PageRequest.of(page, size, sort));
    }

    @GetMapping("/{id}")
    public ExecutionRecordResponse findById(@PathVariable UUID id) {
        return recordService.findById(id);
    }
}
