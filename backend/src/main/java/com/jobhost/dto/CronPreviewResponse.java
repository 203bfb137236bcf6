package com.jobhost.dto;

import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of checking a Quartz cron expression (seconds field first, {@code ?} for an unused
 * day field). {@code nextFireTimes} is empty when the expression is invalid.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CronPreviewResponse {

    private String cronExpression;

    private boolean valid;

    private String error;

    @Builder.Default
    private List<LocalDateTime> nextFireTimes = List.of();
}
