package com.jobhost.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "jobhost_assembly_versions", schema = "jobhost",
        uniqueConstraints = @UniqueConstraint(columnNames = {"assembly_id", "version"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssemblyVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assembly_id", nullable = false)
    @JsonIgnore
    private Assembly assembly;

    @Column(nullable = false, length = 50)
    private String version;

    /** Artifact locator returned by the artifact store. */
    @Column(name = "directory_path", nullable = false, length = 500)
    private String directoryPath;

    /** File name of the jar holding the entry type. */
    @Column(name = "main_artifact_name", nullable = false, length = 255)
    private String mainArtifactName;

    @Column(name = "entry_type", length = 500)
    private String entryType;

    @Column(name = "change_notes", length = 1000)
    private String changeNotes;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = false;

    @OneToMany(mappedBy = "assemblyVersion", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("name")
    @Builder.Default
    private List<ParameterDefinition> parameterDefinitions = new ArrayList<>();

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public void addParameterDefinition(ParameterDefinition definition) {
        definition.setAssemblyVersion(this);
        parameterDefinitions.add(definition);
    }

    @PrePersist
    protected void onCreate() {
        if (uploadedAt == null) uploadedAt = LocalDateTime.now();
    }
}
