package com.jobhost.dto;

import com.jobhost.model.Assembly;
import com.jobhost.model.AssemblyVersion;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssemblyResponse {
    private UUID id;
    private String name;
    private String description;
    private UUID activeVersionId;
    private String activeVersion;
    private LocalDateTime createdAt;

    public static AssemblyResponse from(Assembly assembly) {
        AssemblyVersion active = assembly.getActiveVersion().orElse(null);
        return AssemblyResponse.builder()
                .id(assembly.getId())
                .name(assembly.getName())
                .description(assembly.getDescription())
                .activeVersionId(active != null ? active.getId() : null)
                .activeVersion(active != null ? active.getVersion() : null)
                .createdAt(assembly.getCreatedAt())
                .build();
    }
}
