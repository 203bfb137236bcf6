package com.jobhost.scheduler;

import com.jobhost.exception.SchedulerSyncException;
import com.jobhost.model.Job;
import com.jobhost.model.JobSchedule;
import com.jobhost.model.Schedule;
import com.jobhost.repository.JobScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.quartz.CronScheduleBuilder.cronSchedule;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.TriggerBuilder.newTrigger;

/**
 * Keeps Quartz in line with the Job x Schedule associations. Each job maps to one durable Quartz
 * job keyed {@code job_<id>}; each association maps to one cron trigger named after both ids and
 * grouped by schedule id, which is what makes schedule-wide pause, resume and delete possible.
 * <p>
 * Failures are thrown as {@link SchedulerSyncException} to the administrative caller. Callers
 * must serialise conflicting changes to the same job or schedule.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleReconciler {

    private final Scheduler scheduler;
    private final JobScheduleRepository jobScheduleRepository;

    /** Drops everything Quartz holds and registers every active association. */
    @Transactional(readOnly = true)
    public void initialize() {
        log.info("Initializing job scheduler...");
        try {
            scheduler.clear();
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to clear the scheduler: " + e.getMessage(), e);
        }

        List<JobSchedule> associations = jobScheduleRepository.findAllActive();
        log.info("Found {} active job schedules", associations.size());

        int registered = 0;
        for (JobSchedule association : associations) {
            try {
                register(association);
                registered++;
            } catch (SchedulerSyncException e) {
                log.error("Failed to register job {} on schedule {}: {}", association.getJob().getId(),
                        association.getSchedule().getId(), e.getMessage(), e);
            }
        }
        log.info("Job scheduler initialization completed: {} of {} registered", registered, associations.size());
    }

    /**
     * Ensures the Quartz job for the association's job exists and creates or replaces the
     * association's trigger. Idempotent.
     */
    public void register(JobSchedule association) {
        Job job = association.getJob();
        Schedule schedule = association.getSchedule();
        JobKey jobKey = jobKey(job.getId());
        TriggerKey triggerKey = triggerKey(job.getId(), schedule.getId());

        try {
            if (!scheduler.checkExists(jobKey)) {
                JobDetail detail = newJob(JobFiring.class)
                        .withIdentity(jobKey)
                        .usingJobData(JobFiring.JOB_ID_KEY, job.getId().toString())
                        .storeDurably()
                        .build();
                scheduler.addJob(detail, true);
                log.info("Created quartz job {} for job '{}'", jobKey.getName(), job.getName());
            }

            Trigger trigger = newTrigger()
                    .withIdentity(triggerKey)
                    .forJob(jobKey)
                    .withSchedule(cronSchedule(schedule.getCronExpression()))
                    .build();

            if (scheduler.checkExists(triggerKey)) {
                scheduler.rescheduleJob(triggerKey, trigger);
            } else {
                scheduler.scheduleJob(trigger);
            }
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to schedule job " + job.getId() + " on schedule "
                    + schedule.getId() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // CronScheduleBuilder reports an unparsable expression this way
            throw new SchedulerSyncException("Invalid cron expression '" + schedule.getCronExpression()
                    + "' on schedule " + schedule.getId() + ": " + e.getMessage(), e);
        }
        log.info("Scheduled job {} with schedule {}", job.getId(), schedule.getId());
    }

    /** Rebuilds one job: drops its Quartz job with all triggers and re-registers its active associations. */
    @Transactional(readOnly = true)
    public void updateJob(UUID jobId) {
        deleteJob(jobId);
        for (JobSchedule association : jobScheduleRepository.findActiveByJobId(jobId)) {
            register(association);
        }
    }

    public void deleteJob(UUID jobId) {
        try {
            scheduler.deleteJob(jobKey(jobId));
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to delete quartz job for job " + jobId + ": " + e.getMessage(), e);
        }
    }

    public void pauseJob(UUID jobId) {
        try {
            scheduler.pauseJob(jobKey(jobId));
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to pause job " + jobId + ": " + e.getMessage(), e);
        }
    }

    public void resumeJob(UUID jobId) {
        try {
            scheduler.resumeJob(jobKey(jobId));
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to resume job " + jobId + ": " + e.getMessage(), e);
        }
    }

    /** Drops every trigger of the schedule and re-registers its active associations. */
    @Transactional(readOnly = true)
    public void updateSchedule(UUID scheduleId) {
        List<JobSchedule> associations = jobScheduleRepository.findActiveByScheduleId(scheduleId);
        deleteSchedule(scheduleId);
        for (JobSchedule association : associations) {
            register(association);
        }
    }

    public void deleteSchedule(UUID scheduleId) {
        try {
            Set<TriggerKey> keys = scheduler.getTriggerKeys(groupOf(scheduleId));
            if (!keys.isEmpty()) {
                scheduler.unscheduleJobs(new ArrayList<>(keys));
            }
            log.info("Removed {} trigger(s) of schedule {}", keys.size(), scheduleId);
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to remove triggers of schedule " + scheduleId + ": "
                    + e.getMessage(), e);
        }
    }

    public void pauseSchedule(UUID scheduleId) {
        try {
            scheduler.pauseTriggers(groupOf(scheduleId));
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to pause schedule " + scheduleId + ": " + e.getMessage(), e);
        }
    }

    public void resumeSchedule(UUID scheduleId) {
        try {
            scheduler.resumeTriggers(groupOf(scheduleId));
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to resume schedule " + scheduleId + ": " + e.getMessage(), e);
        }
    }

    public boolean isRegistered(UUID jobId) {
        try {
            return scheduler.checkExists(jobKey(jobId));
        } catch (SchedulerException e) {
            throw new SchedulerSyncException("Failed to look up job " + jobId + ": " + e.getMessage(), e);
        }
    }

    static JobKey jobKey(UUID jobId) {
        return JobKey.jobKey(Job.jobKey(jobId));
    }

    static TriggerKey triggerKey(UUID jobId, UUID scheduleId) {
        return TriggerKey.triggerKey(JobSchedule.triggerName(jobId, scheduleId), Schedule.triggerGroup(scheduleId));
    }

    private static GroupMatcher<TriggerKey> groupOf(UUID scheduleId) {
        return GroupMatcher.triggerGroupEquals(Schedule.triggerGroup(scheduleId));
    }
}
