package com.jobhost.repository;

import com.jobhost.model.JobParameterValue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface JobParameterValueRepository extends JpaRepository<JobParameterValue, UUID> {

    List<JobParameterValue> findByJobIdOrderByName(UUID jobId);
}
