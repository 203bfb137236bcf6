package com.jobhost.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "jobhost_assemblies", schema = "jobhost")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Assembly {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 1000)
    private String description;

    @OneToMany(mappedBy = "assembly", cascade = CascadeType.ALL)
    @OrderBy("uploadedAt DESC")
    @Builder.Default
    private List<AssemblyVersion> versions = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    /** The single active, non-deleted version, if any. */
    public Optional<AssemblyVersion> getActiveVersion() {
        return versions.stream()
                .filter(v -> v.isActive() && v.getDeletedAt() == null)
                .findFirst();
    }

    public void addVersion(AssemblyVersion version) {
        version.setAssembly(this);
        versions.add(version);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
