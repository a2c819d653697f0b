package com.docverify.service.api;

import com.docverify.model.AssertionManifest;
import java.nio.file.Path;
import java.util.Optional;

public interface ManifestStore {

    /**
     * Reads a manifest.
     *
     * @param path Location of the manifest file.
     * @return The manifest, or empty if nothing has been persisted there yet. A missing manifest is a normal
     *         first-run state, not an error.
     * @throws com.docverify.exception.DocVerifyException if a file exists but cannot be parsed.
     */
    Optional<AssertionManifest> load(Path path);

    /**
     * Writes the full manifest, replacing any previous content atomically.
     *
     * @param manifest The manifest to persist.
     * @param path     Location of the manifest file.
     */
    void save(AssertionManifest manifest, Path path);
}
