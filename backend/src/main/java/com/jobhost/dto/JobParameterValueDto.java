package com.jobhost.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobParameterValueDto {

    @NotBlank(message = "Parameter name is required")
    @Size(max = 255)
    private String name;

    @Size(max = 4000)
    private String value;
}
