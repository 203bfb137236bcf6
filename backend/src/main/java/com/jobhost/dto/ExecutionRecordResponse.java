package com.jobhost.dto;

import com.jobhost.model.ExecutionRecord;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionRecordResponse {
    private UUID id;
    private UUID jobId;
    private String fireInstanceId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String status;
    private String errorMessage;

    public static ExecutionRecordResponse from(ExecutionRecord record) {
        return ExecutionRecordResponse.builder()
                .id(record.getId())
                .jobId(record.getJobId())
                .fireInstanceId(record.getFireInstanceId())
                .startTime(record.getStartTime())
                .endTime(record.getEndTime())
                .status(record.getStatus().name())
                .errorMessage(record.getErrorMessage())
                .build();
    }
}
