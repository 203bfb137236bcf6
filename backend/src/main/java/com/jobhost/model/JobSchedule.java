package com.jobhost.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "jobhost_job_schedules", schema = "jobhost",
        uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "schedule_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "job_id", nullable = false)
    private Job job;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id", nullable = false)
    private Schedule schedule;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /** Name of the Quartz trigger binding this job to this schedule. */
    public String getTriggerName() {
        return triggerName(job.getId(), schedule.getId());
    }

    public static String triggerName(UUID jobId, UUID scheduleId) {
        return "trigger_" + jobId + "_" + scheduleId;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
