package com.jobhost.dto;

import com.jobhost.model.JobParameterValue;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobParameterValueResponse {
    private String name;
    private String value;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static JobParameterValueResponse from(JobParameterValue parameter) {
        return JobParameterValueResponse.builder()
                .name(parameter.getName())
                .value(parameter.getValue())
                .createdAt(parameter.getCreatedAt())
                .updatedAt(parameter.getUpdatedAt())
                .build();
    }
}
