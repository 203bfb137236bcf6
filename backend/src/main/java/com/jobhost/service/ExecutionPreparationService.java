package com.jobhost.service;

import com.jobhost.exception.AssemblyNotFoundException;
import com.jobhost.exception.NoActiveVersionException;
import com.jobhost.exception.NotFoundException;
import com.jobhost.model.Assembly;
import com.jobhost.model.AssemblyVersion;
import com.jobhost.model.Job;
import com.jobhost.model.JobParameterValue;
import com.jobhost.repository.AssemblyVersionRepository;
import com.jobhost.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Loads everything a firing needs in one read-only transaction, so the invocation itself runs
 * without holding a persistence session.
 */
@Service
@RequiredArgsConstructor
public class ExecutionPreparationService {

    private final JobRepository jobRepository;
    private final AssemblyVersionRepository versionRepository;
    private final ParameterResolver parameterResolver;

    public record PreparedExecution(
            UUID jobId,
            String jobName,
            UUID versionId,
            String version,
            String locator,
            String entryHint,
            Map<String, Object> parameters
    ) {}

    @Transactional(readOnly = true)
    public PreparedExecution prepare(UUID jobId) {
        Job job = jobRepository.findLiveByIdWithParameters(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));

        Assembly assembly = job.getAssembly();
        if (assembly == null || assembly.getDeletedAt() != null) {
            throw new AssemblyNotFoundException("Assembly of job " + jobId + " not found");
        }

        AssemblyVersion version = versionRepository.findActiveByAssemblyId(assembly.getId())
                .orElseThrow(() -> new NoActiveVersionException(
                        "Assembly '" + assembly.getName() + "' has no active version"));

        Map<String, String> jobValues = new HashMap<>();
        for (JobParameterValue value : job.getParameters()) {
            jobValues.put(value.getName(), value.getValue());
        }
        Map<String, Object> parameters = parameterResolver.resolve(version.getParameterDefinitions(), jobValues);

        return new PreparedExecution(job.getId(), job.getName(), version.getId(), version.getVersion(),
                version.getDirectoryPath(), version.getMainArtifactName(), parameters);
    }
}
