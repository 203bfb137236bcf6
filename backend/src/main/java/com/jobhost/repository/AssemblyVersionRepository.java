package com.jobhost.repository;

import com.jobhost.model.AssemblyVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AssemblyVersionRepository extends JpaRepository<AssemblyVersion, UUID> {

    @Query("SELECT v FROM AssemblyVersion v WHERE v.assembly.id = :assemblyId AND v.deletedAt IS NULL " +
            "ORDER BY v.uploadedAt DESC")
    List<AssemblyVersion> findLiveByAssemblyId(@Param("assemblyId") UUID assemblyId);

    @Query("SELECT v FROM AssemblyVersion v WHERE v.id = :id AND v.assembly.id = :assemblyId " +
            "AND v.deletedAt IS NULL")
    Optional<AssemblyVersion> findLiveById(@Param("assemblyId") UUID assemblyId, @Param("id") UUID id);

    @Query("SELECT DISTINCT v FROM AssemblyVersion v LEFT JOIN FETCH v.parameterDefinitions " +
            "WHERE v.assembly.id = :assemblyId AND v.active = true AND v.deletedAt IS NULL")
    Optional<AssemblyVersion> findActiveByAssemblyId(@Param("assemblyId") UUID assemblyId);

    boolean existsByAssemblyIdAndVersionAndDeletedAtIsNull(UUID assemblyId, String version);
}
