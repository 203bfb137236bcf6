package com.jobhost.service;

import com.jobhost.dto.JobParameterValueResponse;
import com.jobhost.dto.JobRequest;
import com.jobhost.dto.JobResponse;
import com.jobhost.dto.ParameterDefinitionResponse;
import com.jobhost.exception.AssemblyNotFoundException;
import com.jobhost.exception.NotFoundException;
import com.jobhost.model.Assembly;
import com.jobhost.model.Job;
import com.jobhost.model.JobSchedule;
import com.jobhost.model.Schedule;
import com.jobhost.repository.AssemblyRepository;
import com.jobhost.repository.JobRepository;
import com.jobhost.repository.ScheduleRepository;
import com.jobhost.scheduler.ScheduleReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class JobService {

    private final JobRepository repository;
    private final AssemblyRepository assemblyRepository;
    private final ScheduleRepository scheduleRepository;
    private final JobParameterService parameterService;
    private final ScheduleReconciler reconciler;

    // ── CRUD ──────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<JobResponse> findAll() {
        return repository.findAllLive().stream().map(JobResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public JobResponse findById(UUID id) {
        return JobResponse.from(load(id));
    }

    @Transactional
    public JobResponse create(JobRequest req) {
        Assembly assembly = assemblyRepository.findByIdAndDeletedAtIsNull(req.getAssemblyId())
                .orElseThrow(() -> new AssemblyNotFoundException("Assembly not found: " + req.getAssemblyId()));
        parameterService.validate(assembly.getId(), req.getParameters() != null ? req.getParameters() : List.of());
        List<Schedule> schedules = resolveSchedules(req.getScheduleIds());

        Job job = Job.builder()
                .name(req.getName())
                .description(req.getDescription())
                .assembly(assembly)
                .active(req.getActive() == null || req.getActive())
                .build();
        schedules.forEach(job::addSchedule);
        if (req.getParameters() != null) {
            parameterService.apply(job, req.getParameters());
        }
        job = repository.saveAndFlush(job);

        reconciler.updateJob(job.getId());
        log.info("Created job '{}' ({}) on assembly '{}' with {} schedule(s)",
                job.getName(), job.getId(), assembly.getName(), schedules.size());
        return JobResponse.from(job);
    }

    /** Applies the changes and rebuilds the job's scheduler registration. */
    @Transactional
    public JobResponse update(UUID id, JobRequest req) {
        Job job = load(id);
        if (req.getAssemblyId() != null && !req.getAssemblyId().equals(job.getAssembly().getId())) {
            throw new IllegalArgumentException("The assembly of a job cannot be changed");
        }

        job.setName(req.getName());
        job.setDescription(req.getDescription());
        if (req.getActive() != null) {
            job.setActive(req.getActive());
        }
        if (req.getScheduleIds() != null) {
            mergeSchedules(job, resolveSchedules(req.getScheduleIds()));
        }
        if (req.getParameters() != null) {
            parameterService.validate(job.getAssembly().getId(), req.getParameters());
            parameterService.apply(job, req.getParameters());
        }
        job = repository.saveAndFlush(job);

        reconciler.updateJob(job.getId());
        return JobResponse.from(job);
    }

    @Transactional
    public void delete(UUID id) {
        Job job = load(id);
        reconciler.deleteJob(id);
        job.setDeletedAt(LocalDateTime.now());
        repository.save(job);
        log.info("Deleted job {}", id);
    }

    // ── Scheduler control ─────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public void pause(UUID id) {
        load(id);
        reconciler.pauseJob(id);
    }

    @Transactional(readOnly = true)
    public void resume(UUID id) {
        load(id);
        reconciler.resumeJob(id);
    }

    // ── Parameters ────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<ParameterDefinitionResponse> getParameterDefinitions(UUID id) {
        Job job = load(id);
        return parameterService.getDefinitions(job.getAssembly().getId()).stream()
                .map(ParameterDefinitionResponse::from)
                .toList();
    }

    public List<JobParameterValueResponse> getParameterValues(UUID id) {
        return parameterService.getValues(id);
    }

    // ── Helpers ────────────────────────────────────────────────────────────

    private Job load(UUID id) {
        return repository.findLiveByIdWithParameters(id)
                .orElseThrow(() -> new NotFoundException("Job not found: " + id));
    }

    private List<Schedule> resolveSchedules(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<UUID> wanted = new LinkedHashSet<>(ids);
        List<Schedule> found = scheduleRepository.findByIdInAndDeletedAtIsNull(wanted);
        if (found.size() != wanted.size()) {
            Set<UUID> foundIds = found.stream().map(Schedule::getId).collect(Collectors.toSet());
            wanted.removeAll(foundIds);
            throw new NotFoundException("Schedules not found: " + wanted);
        }
        return found;
    }

    private static void mergeSchedules(Job job, List<Schedule> schedules) {
        Set<UUID> wanted = schedules.stream().map(Schedule::getId).collect(Collectors.toSet());
        job.getJobSchedules().removeIf(js -> !wanted.contains(js.getSchedule().getId()));
        Set<UUID> present = job.getJobSchedules().stream()
                .map(JobSchedule::getSchedule)
                .map(Schedule::getId)
                .collect(Collectors.toSet());
        schedules.stream()
                .filter(s -> !present.contains(s.getId()))
                .forEach(job::addSchedule);
    }
}
