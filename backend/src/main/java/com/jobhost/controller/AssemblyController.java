package com.jobhost.controller;

import com.jobhost.dto.AssemblyResponse;
import com.jobhost.dto.AssemblyVersionResponse;
import com.jobhost.service.AssemblyService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/assemblies")
@RequiredArgsConstructor
public class AssemblyController {

    private final AssemblyService assemblyService;

    @GetMapping
    public List<AssemblyResponse> findAll() {
        return assemblyService.findAll();
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AssemblyResponse> create(
            @RequestParam("name") String name,
            @RequestParam(value = "description", required = false) String description,
            @RequestParam("mainArtifactName") String mainArtifactName,
            @RequestParam("file") MultipartFile file) throws IOException {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(assemblyService.create(name, description, mainArtifactName, file.getBytes()));
    }

    @GetMapping("/{id}")
    public AssemblyResponse findById(@PathVariable UUID id) {
        return assemblyService.findById(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        assemblyService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(value = "/{id}/versions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AssemblyVersionResponse> addVersion(
            @PathVariable UUID id,
            @RequestParam("version") String version,
            @RequestParam("mainArtifactName") String mainArtifactName,
            @RequestParam(value = "changeNotes", required = false) String changeNotes,
            @RequestParam("file") MultipartFile file) throws IOException {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(assemblyService.addVersion(id, version, mainArtifactName, changeNotes, file.getBytes()));
    }

    @GetMapping("/{id}/versions")
    public List<AssemblyVersionResponse> findVersions(@PathVariable UUID id) {
        return assemblyService.findVersions(id);
    }

    @GetMapping("/{id}/versions/{versionId}")
    public AssemblyVersionResponse findVersion(@PathVariable UUID id, @PathVariable UUID versionId) {
        return assemblyService.findVersion(id, versionId);
    }

    @PutMapping("/{id}/versions/{versionId}/activate")
    public AssemblyVersionResponse activate(@PathVariable UUID id, @PathVariable UUID versionId) {
        return assemblyService.setActiveVersion(id, versionId);
    }
}
