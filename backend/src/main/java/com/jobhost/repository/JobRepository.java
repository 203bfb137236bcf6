package com.jobhost.repository;

import com.jobhost.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository extends JpaRepository<Job, UUID> {

    @Query("SELECT j FROM Job j JOIN FETCH j.assembly WHERE j.deletedAt IS NULL ORDER BY j.name")
    List<Job> findAllLive();

    @Query("SELECT j FROM Job j JOIN FETCH j.assembly a WHERE j.id = :id AND j.deletedAt IS NULL")
    Optional<Job> findLiveById(@Param("id") UUID id);

    @Query("SELECT j FROM Job j LEFT JOIN FETCH j.parameters JOIN FETCH j.assembly " +
            "WHERE j.id = :id AND j.deletedAt IS NULL")
    Optional<Job> findLiveByIdWithParameters(@Param("id") UUID id);

    @Query("SELECT j.id FROM Job j WHERE j.assembly.id = :assemblyId AND j.deletedAt IS NULL")
    List<UUID> findLiveIdsByAssemblyId(@Param("assemblyId") UUID assemblyId);

    @Query("SELECT CASE WHEN COUNT(j) > 0 THEN true ELSE false END FROM Job j WHERE j.assembly.id = :assemblyId AND j.active = true " +
            "AND j.deletedAt IS NULL")
    boolean existsActiveByAssemblyId(@Param("assemblyId") UUID assemblyId);
}
