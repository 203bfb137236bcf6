package com.jobhost.controller;

import com.jobhost.dto.CronPreviewResponse;
import com.jobhost.dto.ScheduleRequest;
import com.jobhost.dto.ScheduleResponse;
import com.jobhost.service.CronValidationService;
import com.jobhost.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @GetMapping
    public List<ScheduleResponse> findAll() {
        return scheduleService.findAll();
    }

    @PostMapping
    public ResponseEntity<ScheduleResponse> create(@Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.create(request));
    }

    @GetMapping("/{id}")
    public ScheduleResponse findById(@PathVariable UUID id) {
        return scheduleService.findById(id);
    }

    @PutMapping("/{id}")
    public ScheduleResponse update(@PathVariable UUID id, @Valid @RequestBody ScheduleRequest request) {
        return scheduleService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        scheduleService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Void> pause(@PathVariable UUID id) {
        scheduleService.pause(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Void> resume(@PathVariable UUID id) {
        scheduleService.resume(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/next-executions")
    public List<LocalDateTime> nextExecutions(@PathVariable UUID id,
                                              @RequestParam(defaultValue = "" + CronValidationService.DEFAULT_COUNT) int count) {
        return scheduleService.nextExecutions(id, count);
    }

    @GetMapping("/preview")
    public CronPreviewResponse preview(@RequestParam String cron,
                                       @RequestParam(defaultValue = "" + CronValidationService.DEFAULT_COUNT) int count) {
        return scheduleService.preview(cron, count);
    }
}
