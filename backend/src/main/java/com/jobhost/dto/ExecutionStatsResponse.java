package com.jobhost.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionStatsResponse {
    private long runningCount;
    private long successCount;
    private long failedCount;
    private long cancelledCount;
}
