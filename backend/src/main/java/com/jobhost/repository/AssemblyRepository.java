package com.jobhost.repository;

import com.jobhost.model.Assembly;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AssemblyRepository extends JpaRepository<Assembly, UUID> {

    @Query("SELECT a FROM Assembly a WHERE a.deletedAt IS NULL ORDER BY a.name")
    List<Assembly> findAllLive();

    Optional<Assembly> findByIdAndDeletedAtIsNull(UUID id);

    /** Row lock held until the surrounding transaction ends; serialises version activation. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Assembly a WHERE a.id = :id AND a.deletedAt IS NULL")
    Optional<Assembly> findLiveByIdForUpdate(@Param("id") UUID id);

    boolean existsByNameAndDeletedAtIsNull(String name);
}
