package com.jobhost.plugin;

/**
 * Stores uploaded job artifacts and hands them back as loadable units.
 */
public interface ArtifactStore {

    /**
     * Persists the zip payload of one version.
     *
     * @return the locator to record with the version
     */
    String save(String assemblyName, String version, byte[] zipData);

    /**
     * Resolves a stored version.
     *
     * @param entryHint file name of the jar holding the entry type
     * @throws com.jobhost.exception.ArtifactLoadException if the locator or the jar does not exist
     */
    LoadableUnit load(String locator, String entryHint);

    /** Removes a stored version; used when a freshly saved version is rejected. */
    void delete(String locator);
}
