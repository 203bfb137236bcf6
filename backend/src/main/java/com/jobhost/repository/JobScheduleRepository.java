package com.jobhost.repository;

import com.jobhost.model.JobSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

/**
 * Every "active" query here requires both sides of the association to be active and not deleted.
 */
public interface JobScheduleRepository extends JpaRepository<JobSchedule, UUID> {

    @Query("SELECT js FROM JobSchedule js JOIN FETCH js.job j JOIN FETCH js.schedule s " +
            "WHERE j.active = true AND j.deletedAt IS NULL AND s.active = true AND s.deletedAt IS NULL")
    List<JobSchedule> findAllActive();

    @Query("SELECT js FROM JobSchedule js JOIN FETCH js.job j JOIN FETCH js.schedule s " +
            "WHERE j.id = :jobId AND j.active = true AND j.deletedAt IS NULL " +
            "AND s.active = true AND s.deletedAt IS NULL")
    List<JobSchedule> findActiveByJobId(@Param("jobId") UUID jobId);

    @Query("SELECT js FROM JobSchedule js JOIN FETCH js.job j JOIN FETCH js.schedule s " +
            "WHERE s.id = :scheduleId AND j.active = true AND j.deletedAt IS NULL " +
            "AND s.active = true AND s.deletedAt IS NULL")
    List<JobSchedule> findActiveByScheduleId(@Param("scheduleId") UUID scheduleId);

    @Query("SELECT js FROM JobSchedule js JOIN FETCH js.schedule s WHERE js.job.id = :jobId " +
            "AND s.deletedAt IS NULL ORDER BY s.name")
    List<JobSchedule> findLiveByJobId(@Param("jobId") UUID jobId);
}
