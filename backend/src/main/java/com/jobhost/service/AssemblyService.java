package com.jobhost.service;

import com.jobhost.dto.AssemblyResponse;
import com.jobhost.dto.AssemblyVersionResponse;
import com.jobhost.exception.AssemblyNotFoundException;
import com.jobhost.exception.NotFoundException;
import com.jobhost.model.Assembly;
import com.jobhost.model.AssemblyVersion;
import com.jobhost.plugin.ArtifactStore;
import com.jobhost.plugin.PluginInspector;
import com.jobhost.repository.AssemblyRepository;
import com.jobhost.repository.AssemblyVersionRepository;
import com.jobhost.repository.JobRepository;
import com.jobhost.scheduler.ScheduleReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Registers job artifacts and their versions. Every version is inspected before it is stored, so
 * a stored version always has an entry type and a valid set of parameter definitions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssemblyService {

    static final String INITIAL_VERSION = "1.0.0";

    private final AssemblyRepository repository;
    private final AssemblyVersionRepository versionRepository;
    private final JobRepository jobRepository;
    private final ArtifactStore artifactStore;
    private final PluginInspector inspector;
    private final ScheduleReconciler reconciler;

    // ── Assemblies ────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<AssemblyResponse> findAll() {
        return repository.findAllLive().stream().map(AssemblyResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public AssemblyResponse findById(UUID id) {
        return AssemblyResponse.from(load(id));
    }

    /** Creates the assembly with version {@value #INITIAL_VERSION}, which becomes active. */
    @Transactional
    public AssemblyResponse create(String name, String description, String mainArtifactName, byte[] zipData) {
        requireText(name, "Assembly name");
        requireText(mainArtifactName, "Main artifact name");
        if (repository.existsByNameAndDeletedAtIsNull(name)) {
            throw new IllegalStateException("Assembly with name '" + name + "' already exists");
        }

        Assembly assembly = Assembly.builder()
                .name(name)
                .description(description)
                .build();
        AssemblyVersion version = storeVersion(name, INITIAL_VERSION, mainArtifactName, null, zipData);
        version.setActive(true);
        assembly.addVersion(version);

        assembly = repository.save(assembly);
        log.info("Created assembly '{}' ({}) with entry type {}", name, assembly.getId(), version.getEntryType());
        return AssemblyResponse.from(assembly);
    }

    @Transactional
    public void delete(UUID id) {
        Assembly assembly = load(id);
        if (jobRepository.existsActiveByAssemblyId(id)) {
            throw new IllegalStateException("Cannot delete assembly '" + assembly.getName()
                    + "' because it has active jobs");
        }
        assembly.setDeletedAt(LocalDateTime.now());
        repository.save(assembly);
        log.info("Deleted assembly {}", id);
    }

    // ── Versions ──────────────────────────────────────────────────────────

    /** Adds a version. It only becomes active when the assembly has no other version. */
    @Transactional
    public AssemblyVersionResponse addVersion(UUID assemblyId, String version, String mainArtifactName,
                                              String changeNotes, byte[] zipData) {
        requireText(version, "Version");
        requireText(mainArtifactName, "Main artifact name");
        Assembly assembly = repository.findLiveByIdForUpdate(assemblyId)
                .orElseThrow(() -> new AssemblyNotFoundException("Assembly not found: " + assemblyId));
        if (versionRepository.existsByAssemblyIdAndVersionAndDeletedAtIsNull(assemblyId, version)) {
            throw new IllegalStateException("Version '" + version + "' already exists for assembly '"
                    + assembly.getName() + "'");
        }
        boolean first = versionRepository.findLiveByAssemblyId(assemblyId).isEmpty();

        AssemblyVersion stored = storeVersion(assembly.getName(), version, mainArtifactName, changeNotes, zipData);
        stored.setActive(first);
        assembly.addVersion(stored);
        stored = versionRepository.save(stored);

        log.info("Added version {} to assembly '{}'{}", version, assembly.getName(), first ? " (active)" : "");
        return AssemblyVersionResponse.from(stored);
    }

    @Transactional(readOnly = true)
    public List<AssemblyVersionResponse> findVersions(UUID assemblyId) {
        load(assemblyId);
        return versionRepository.findLiveByAssemblyId(assemblyId).stream()
                .map(AssemblyVersionResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public AssemblyVersionResponse findVersion(UUID assemblyId, UUID versionId) {
        return AssemblyVersionResponse.from(loadVersion(assemblyId, versionId));
    }

    /**
     * Makes one version the active one. The assembly row stays locked until commit, so concurrent
     * activations of the same assembly run one after the other.
     */
    @Transactional
    public AssemblyVersionResponse setActiveVersion(UUID assemblyId, UUID versionId) {
        Assembly assembly = repository.findLiveByIdForUpdate(assemblyId)
                .orElseThrow(() -> new AssemblyNotFoundException("Assembly not found: " + assemblyId));
        AssemblyVersion target = loadVersion(assemblyId, versionId);

        List<AssemblyVersion> others = versionRepository.findLiveByAssemblyId(assemblyId).stream()
                .filter(v -> v.isActive() && !v.getId().equals(versionId))
                .toList();
        others.forEach(v -> v.setActive(false));
        // deactivations must reach the database before the activation
        versionRepository.saveAllAndFlush(others);

        target.setActive(true);
        target = versionRepository.saveAndFlush(target);

        for (UUID jobId : jobRepository.findLiveIdsByAssemblyId(assemblyId)) {
            reconciler.updateJob(jobId);
        }
        log.info("Activated version {} of assembly '{}'", target.getVersion(), assembly.getName());
        return AssemblyVersionResponse.from(target);
    }

    // ── Helpers ────────────────────────────────────────────────────────────

    private AssemblyVersion storeVersion(String assemblyName, String version, String mainArtifactName,
                                         String changeNotes, byte[] zipData) {
        if (zipData == null || zipData.length == 0) {
            throw new IllegalArgumentException("No archive uploaded");
        }
        String locator = artifactStore.save(assemblyName, version, zipData);
        PluginInspector.Inspection inspection;
        try {
            inspection = inspector.inspect(artifactStore.load(locator, mainArtifactName));
        } catch (RuntimeException e) {
            artifactStore.delete(locator);
            throw e;
        }

        AssemblyVersion stored = AssemblyVersion.builder()
                .version(version)
                .directoryPath(locator)
                .mainArtifactName(mainArtifactName)
                .entryType(inspection.entryType())
                .changeNotes(changeNotes)
                .build();
        inspection.parameterDefinitions().forEach(stored::addParameterDefinition);
        return stored;
    }

    private Assembly load(UUID id) {
        return repository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new AssemblyNotFoundException("Assembly not found: " + id));
    }

    private AssemblyVersion loadVersion(UUID assemblyId, UUID versionId) {
        return versionRepository.findLiveById(assemblyId, versionId)
                .orElseThrow(() -> new NotFoundException("Version " + versionId + " not found for assembly "
                        + assemblyId));
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }
}
