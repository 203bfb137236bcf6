package com.jobhost.service;

import com.jobhost.dto.JobParameterValueDto;
import com.jobhost.dto.JobParameterValueResponse;
import com.jobhost.exception.AssemblyNotFoundException;
import com.jobhost.exception.MissingRequiredParameterException;
import com.jobhost.exception.NoActiveVersionException;
import com.jobhost.exception.NotFoundException;
import com.jobhost.exception.ParameterConversionException;
import com.jobhost.model.AssemblyVersion;
import com.jobhost.model.Job;
import com.jobhost.model.JobParameterValue;
import com.jobhost.model.ParameterDefinition;
import com.jobhost.repository.AssemblyRepository;
import com.jobhost.repository.AssemblyVersionRepository;
import com.jobhost.repository.JobParameterValueRepository;
import com.jobhost.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates and stores job-level parameter values. Values dropped by an update are kept as
 * tombstones with a null value so the definition's default applies again.
 */
@Service
@RequiredArgsConstructor
public class JobParameterService {

    private final JobRepository jobRepository;
    private final JobParameterValueRepository valueRepository;
    private final AssemblyRepository assemblyRepository;
    private final AssemblyVersionRepository versionRepository;
    private final ParameterTypeRegistry typeRegistry;

    @Transactional(readOnly = true)
    public List<JobParameterValueResponse> getValues(UUID jobId) {
        if (jobRepository.findLiveById(jobId).isEmpty()) {
            throw new NotFoundException("Job not found: " + jobId);
        }
        return valueRepository.findByJobIdOrderByName(jobId).stream()
                .map(JobParameterValueResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ParameterDefinition> getDefinitions(UUID assemblyId) {
        return activeVersion(assemblyId).getParameterDefinitions();
    }

    /**
     * Checks provided values against the definitions of the assembly's active version: every
     * required parameter without a default needs a non-empty value, every non-empty value must
     * convert to its declared type, and no unknown names are allowed.
     */
    @Transactional(readOnly = true)
    public void validate(UUID assemblyId, Collection<JobParameterValueDto> values) {
        Map<String, ParameterDefinition> definitions = activeVersion(assemblyId).getParameterDefinitions().stream()
                .collect(Collectors.toMap(ParameterDefinition::getName, Function.identity(), (a, b) -> a,
                        LinkedHashMap::new));
        Map<String, String> provided = byName(values);

        for (ParameterDefinition definition : definitions.values()) {
            String value = provided.get(definition.getName());
            if (value == null || value.isEmpty()) {
                if (definition.isRequired() && isEmpty(definition.getDefaultValue())) {
                    throw new MissingRequiredParameterException(
                            "Required parameter '" + definition.getName() + "' is missing");
                }
                continue;
            }
            try {
                typeRegistry.convert(value, definition.getType());
            } catch (ParameterConversionException e) {
                throw new IllegalArgumentException("Invalid value for parameter '" + definition.getName()
                        + "'. Expected type: " + definition.getType() + ". Error: " + e.getMessage(), e);
            }
        }

        Set<String> unknown = provided.keySet().stream()
                .filter(name -> !definitions.containsKey(name))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown parameters provided: " + String.join(", ", unknown));
        }
    }

    @Transactional
    public List<JobParameterValueResponse> setValues(UUID jobId, Collection<JobParameterValueDto> values) {
        Job job = jobRepository.findLiveByIdWithParameters(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
        validate(job.getAssembly().getId(), values);
        apply(job, values);
        jobRepository.saveAndFlush(job);
        return job.getParameters().stream().map(JobParameterValueResponse::from).toList();
    }

    /** Merges already validated values into the job's parameter rows. */
    void apply(Job job, Collection<JobParameterValueDto> values) {
        Map<String, String> provided = byName(values);
        Map<String, JobParameterValue> existing = job.getParameters().stream()
                .collect(Collectors.toMap(JobParameterValue::getName, Function.identity()));

        provided.forEach((name, value) -> {
            JobParameterValue row = existing.get(name);
            if (row != null) {
                row.setValue(value);
            } else {
                job.addParameter(name, value);
            }
        });
        existing.values().stream()
                .filter(row -> !provided.containsKey(row.getName()))
                .forEach(row -> row.setValue(null));
    }

    private AssemblyVersion activeVersion(UUID assemblyId) {
        if (assemblyRepository.findByIdAndDeletedAtIsNull(assemblyId).isEmpty()) {
            throw new AssemblyNotFoundException("Assembly not found: " + assemblyId);
        }
        return versionRepository.findActiveByAssemblyId(assemblyId)
                .orElseThrow(() -> new NoActiveVersionException("Assembly " + assemblyId + " has no active version"));
    }

    private static Map<String, String> byName(Collection<JobParameterValueDto> values) {
        Map<String, String> byName = new LinkedHashMap<>();
        for (JobParameterValueDto value : values) {
            if (byName.containsKey(value.getName())) {
                throw new IllegalArgumentException("Parameter '" + value.getName() + "' is given more than once");
            }
            byName.put(value.getName(), value.getValue());
        }
        return byName;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
