package com.jobhost.plugin;

import com.jobhost.config.JobHostProperties;
import com.jobhost.exception.ArtifactLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Keeps each version extracted under {@code <base>/<assembly>/<version>/}. The locator is that
 * directory's path.
 */
@Component
@Slf4j
public class LocalArtifactStore implements ArtifactStore {

    private final Path baseDirectory;

    public LocalArtifactStore(JobHostProperties properties) {
        this.baseDirectory = Path.of(properties.artifacts().basePath()).toAbsolutePath().normalize();
    }

    @Override
    public String save(String assemblyName, String version, byte[] zipData) {
        Path target = baseDirectory.resolve(sanitize(assemblyName)).resolve(sanitize(version));
        if (Files.exists(target)) {
            throw new IllegalStateException("Artifact directory already exists: " + target);
        }
        try {
            Files.createDirectories(target);
            int files = extract(zipData, target);
            if (files == 0) {
                throw new IllegalArgumentException("The uploaded archive is empty");
            }
            log.info("Extracted {} file(s) of {} {} to {}", files, assemblyName, version, target);
            return target.toString();
        } catch (IOException e) {
            deleteQuietly(target);
            throw new UncheckedIOException("Failed to store " + assemblyName + " " + version, e);
        } catch (RuntimeException e) {
            deleteQuietly(target);
            throw e;
        }
    }

    @Override
    public LoadableUnit load(String locator, String entryHint) {
        Path directory = Path.of(locator);
        if (!Files.isDirectory(directory)) {
            throw new ArtifactLoadException("Artifact directory not found: " + directory);
        }
        Path mainJar = directory.resolve(entryHint).normalize();
        if (!mainJar.startsWith(directory) || !Files.isRegularFile(mainJar)) {
            throw new ArtifactLoadException("Artifact file not found: " + mainJar);
        }
        try (Stream<Path> files = Files.walk(directory)) {
            List<Path> dependencies = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .filter(p -> !p.equals(mainJar))
                    .sorted()
                    .toList();
            return new LoadableUnit(mainJar, dependencies);
        } catch (IOException e) {
            throw new ArtifactLoadException("Failed to list artifact directory " + directory, e);
        }
    }

    @Override
    public void delete(String locator) {
        Path directory = Path.of(locator).toAbsolutePath().normalize();
        if (!directory.startsWith(baseDirectory) || directory.equals(baseDirectory)) {
            throw new IllegalArgumentException("Locator outside the artifact directory: " + locator);
        }
        deleteQuietly(directory);
        log.info("Removed artifact directory {}", directory);
    }

    private int extract(byte[] zipData, Path target) throws IOException {
        int count = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(zipData))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path out = target.resolve(entry.getName()).normalize();
                if (!out.startsWith(target)) {
                    throw new IllegalArgumentException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    Files.copy(zip, out);
                    count++;
                }
            }
        }
        return count;
    }

    private void deleteQuietly(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", directory, e.getMessage());
        }
    }

    static String sanitize(String segment) {
        String cleaned = segment.trim().replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
            throw new IllegalArgumentException("Invalid path segment: '" + segment + "'");
        }
        return cleaned;
    }
}
