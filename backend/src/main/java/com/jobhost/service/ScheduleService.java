package com.jobhost.service;

import com.jobhost.dto.CronPreviewResponse;
import com.jobhost.dto.ScheduleRequest;
import com.jobhost.dto.ScheduleResponse;
import com.jobhost.exception.NotFoundException;
import com.jobhost.model.Schedule;
import com.jobhost.repository.ScheduleRepository;
import com.jobhost.scheduler.ScheduleReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final ScheduleRepository repository;
    private final CronValidationService cronValidationService;
    private final ScheduleReconciler reconciler;

    // ── CRUD ──────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<ScheduleResponse> findAll() {
        return repository.findAllLive().stream().map(ScheduleResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public ScheduleResponse findById(UUID id) {
        return ScheduleResponse.from(load(id));
    }

    @Transactional
    public ScheduleResponse create(ScheduleRequest req) {
        if (req.getCronExpression() == null) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        cronValidationService.validate(req.getCronExpression());

        Schedule schedule = Schedule.builder()
                .name(req.getName())
                .description(req.getDescription())
                .cronExpression(req.getCronExpression().trim())
                .active(true)
                .build();
        schedule = repository.save(schedule);
        log.info("Created schedule '{}' ({}) with cron '{}'", schedule.getName(), schedule.getId(),
                schedule.getCronExpression());
        return ScheduleResponse.from(schedule);
    }

    /** Applies the changes and rebuilds every trigger of the schedule. */
    @Transactional
    public ScheduleResponse update(UUID id, ScheduleRequest req) {
        Schedule schedule = load(id);

        schedule.setDescription(req.getDescription());
        if (req.getCronExpression() != null) {
            cronValidationService.validate(req.getCronExpression());
            schedule.setCronExpression(req.getCronExpression().trim());
        }
        if (req.getActive() != null) {
            schedule.setActive(req.getActive());
        }
        schedule = repository.saveAndFlush(schedule);

        reconciler.updateSchedule(schedule.getId());
        return ScheduleResponse.from(schedule);
    }

    @Transactional
    public void delete(UUID id) {
        Schedule schedule = load(id);
        reconciler.deleteSchedule(id);
        schedule.setDeletedAt(LocalDateTime.now());
        repository.save(schedule);
        log.info("Deleted schedule {}", id);
    }

    // ── Scheduler control ─────────────────────────────────────────────────

    /** Pauses every trigger of the schedule without touching its stored active flag. */
    @Transactional(readOnly = true)
    public void pause(UUID id) {
        load(id);
        reconciler.pauseSchedule(id);
    }

    @Transactional(readOnly = true)
    public void resume(UUID id) {
        load(id);
        reconciler.resumeSchedule(id);
    }

    // ── Cron preview ──────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<LocalDateTime> nextExecutions(UUID id, int count) {
        return cronValidationService.nextFireTimes(load(id).getCronExpression(), count);
    }

    public CronPreviewResponse preview(String cronExpression, int count) {
        String expression = cronExpression == null ? null : cronExpression.trim();
        try {
            return CronPreviewResponse.builder()
                    .cronExpression(expression)
                    .valid(true)
                    .nextFireTimes(cronValidationService.nextFireTimes(expression, count))
                    .build();
        } catch (IllegalArgumentException e) {
            return CronPreviewResponse.builder()
                    .cronExpression(expression)
                    .valid(false)
                    .error(e.getMessage())
                    .build();
        }
    }

    private Schedule load(UUID id) {
        return repository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new NotFoundException("Schedule not found: " + id));
    }
}
