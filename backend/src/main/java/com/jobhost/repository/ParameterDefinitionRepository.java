package com.jobhost.repository;

import com.jobhost.model.ParameterDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ParameterDefinitionRepository extends JpaRepository<ParameterDefinition, UUID> {

    List<ParameterDefinition> findByAssemblyVersionIdOrderByName(UUID assemblyVersionId);
}
