package com.jobhost.repository;

import com.jobhost.model.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    @Query("SELECT s FROM Schedule s WHERE s.deletedAt IS NULL ORDER BY s.name")
    List<Schedule> findAllLive();

    Optional<Schedule> findByIdAndDeletedAtIsNull(UUID id);

    List<Schedule> findByIdInAndDeletedAtIsNull(Collection<UUID> ids);
}
