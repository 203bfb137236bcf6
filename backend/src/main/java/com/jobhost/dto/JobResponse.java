package com.jobhost.dto;

import com.jobhost.model.Job;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobResponse {
    private UUID id;
    private String name;
    private String description;
    private UUID assemblyId;
    private String assemblyName;
    private boolean active;
    private List<UUID> scheduleIds;
    private List<JobParameterValueResponse> parameters;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static JobResponse from(Job job) {
        return JobResponse.builder()
                .id(job.getId())
                .name(job.getName())
                .description(job.getDescription())
                .assemblyId(job.getAssembly().getId())
                .assemblyName(job.getAssembly().getName())
                .active(job.isActive())
                .scheduleIds(job.getJobSchedules().stream()
                        .filter(js -> js.getSchedule().getDeletedAt() == null)
                        .map(js -> js.getSchedule().getId())
                        .toList())
                .parameters(job.getParameters().stream()
                        .filter(p -> p.getValue() != null)
                        .map(JobParameterValueResponse::from)
                        .toList())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
