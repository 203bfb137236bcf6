package com.jobhost.dto;

import com.jobhost.model.Schedule;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleResponse {
    private UUID id;
    private String name;
    private String description;
    private String cronExpression;
    private boolean active;
    private List<UUID> jobIds;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ScheduleResponse from(Schedule schedule) {
        return ScheduleResponse.builder()
                .id(schedule.getId())
                .name(schedule.getName())
                .description(schedule.getDescription())
                .cronExpression(schedule.getCronExpression())
                .active(schedule.isActive())
                .jobIds(schedule.getJobSchedules().stream()
                        .filter(js -> js.getJob().getDeletedAt() == null)
                        .map(js -> js.getJob().getId())
                        .toList())
                .createdAt(schedule.getCreatedAt())
                .updatedAt(schedule.getUpdatedAt())
                .build();
    }
}
