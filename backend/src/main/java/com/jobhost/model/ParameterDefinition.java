package com.jobhost.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "jobhost_parameter_definitions", schema = "jobhost",
        uniqueConstraints = @UniqueConstraint(columnNames = {"assembly_version_id", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParameterDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assembly_version_id", nullable = false)
    @JsonIgnore
    private AssemblyVersion assemblyVersion;

    @Column(nullable = false, length = 255)
    private String name;

    /** Type tag understood by {@code ParameterTypeRegistry}, e.g. {@code int} or {@code java.lang.Integer}. */
    @Column(nullable = false, length = 255)
    private String type;

    @Column(nullable = false)
    @Builder.Default
    private boolean required = false;

    @Column(name = "default_value", length = 4000)
    private String defaultValue;

    @Column(length = 1000)
    private String description;
}
