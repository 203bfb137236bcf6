package com.jobhost.controller;

import com.jobhost.dto.ExecutionRecordResponse;
import com.jobhost.dto.JobParameterValueDto;
import com.jobhost.dto.JobParameterValueResponse;
import com.jobhost.dto.JobRequest;
import com.jobhost.dto.JobResponse;
import com.jobhost.dto.PageResponse;
import com.jobhost.dto.ParameterDefinitionResponse;
import com.jobhost.service.ExecutionRecordService;
import com.jobhost.service.JobParameterService;
import com.jobhost.service.JobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private static final int MAX_PAGE_SIZE = 100;

    private final JobService jobService;
    private final JobParameterService parameterService;
    private final ExecutionRecordService recordService;

    @GetMapping
    public List<JobResponse> findAll() {
        return jobService.findAll();
    }

    @PostMapping
    public ResponseEntity<JobResponse> create(@Valid @RequestBody JobRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.create(request));
    }

    @GetMapping("/{id}")
    public JobResponse findById(@PathVariable UUID id) {
        return jobService.findById(id);
    }

    @PutMapping("/{id}")
    public JobResponse update(@PathVariable UUID id, @Valid @RequestBody JobRequest request) {
        return jobService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        jobService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Void> pause(@PathVariable UUID id) {
        jobService.pause(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Void> resume(@PathVariable UUID id) {
        jobService.resume(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/parameter-definitions")
    public List<ParameterDefinitionResponse> getParameterDefinitions(@PathVariable UUID id) {
        return jobService.getParameterDefinitions(id);
    }

    @GetMapping("/{id}/parameters")
    public List<JobParameterValueResponse> getParameters(@PathVariable UUID id) {
        return jobService.getParameterValues(id);
    }

    @PutMapping("/{id}/parameters")
    public List<JobParameterValueResponse> setParameters(@PathVariable UUID id,
                                                         @Valid @RequestBody List<JobParameterValueDto> parameters) {
        return parameterService.setValues(id, parameters);
    }

    @GetMapping("/{id}/executions")
    public PageResponse<ExecutionRecordResponse> getExecutions(@PathVariable UUID id,
                                                               @RequestParam(defaultValue = "0") int page,
                                                               @RequestParam(defaultValue = "20") int size) {
        if (size < 1) size = 20;
        if (size > MAX_PAGE_SIZE) size = MAX_PAGE_SIZE;
        if (page < 0) page = 0;
        return recordService.findByJob(id, PageRequest.of(page, size, Sort.by("startTime").descending()));
    }
}
