package com.jobhost.dto;

import com.jobhost.model.AssemblyVersion;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssemblyVersionResponse {
    private UUID id;
    private UUID assemblyId;
    private String version;
    private String mainArtifactName;
    private String entryType;
    private String changeNotes;
    private boolean active;
    private LocalDateTime uploadedAt;
    private List<ParameterDefinitionResponse> parameters;

    public static AssemblyVersionResponse from(AssemblyVersion version) {
        return AssemblyVersionResponse.builder()
                .id(version.getId())
                .assemblyId(version.getAssembly().getId())
                .version(version.getVersion())
                .mainArtifactName(version.getMainArtifactName())
                .entryType(version.getEntryType())
                .changeNotes(version.getChangeNotes())
                .active(version.isActive())
                .uploadedAt(version.getUploadedAt())
                .parameters(version.getParameterDefinitions().stream()
                        .map(ParameterDefinitionResponse::from)
                        .toList())
                .build();
    }
}
