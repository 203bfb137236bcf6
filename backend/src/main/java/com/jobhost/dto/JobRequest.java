package com.jobhost.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;
import java.util.UUID;

/**
 * Create and update payload. On update a null {@code active}, {@code scheduleIds} or
 * {@code parameters} leaves that part of the job unchanged; the assembly cannot be changed.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255)
    private String name;

    @Size(max = 1000)
    private String description;

    @NotNull(message = "Assembly ID is required")
    private UUID assemblyId;

    private Boolean active;

    private List<UUID> scheduleIds;

    @Valid
    private List<JobParameterValueDto> parameters;
}
