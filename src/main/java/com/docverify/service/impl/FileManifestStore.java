package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.AssertionManifest;
import com.docverify.service.api.ManifestStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Persists the manifest as one pretty-printed JSON document, meant to be checked into version control and
 * diffed between extraction runs.
 * <p>
 * Writes go to a temporary file next to the target which is then moved over it, so a concurrent reader sees
 * either the old manifest or the new one, never half of each.
 */
@Service
@Slf4j
public class FileManifestStore implements ManifestStore {

    private final ObjectMapper objectMapper;

    public FileManifestStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AssertionManifest> load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("No manifest at {}", path);
            return Optional.empty();
        }
        try {
            AssertionManifest manifest = objectMapper.readValue(path.toFile(), AssertionManifest.class);
            if (manifest.getVersion() > AssertionManifest.CURRENT_VERSION) {
                throw new DocVerifyException("Manifest " + path + " has version " + manifest.getVersion()
                        + ", this build understands up to " + AssertionManifest.CURRENT_VERSION);
            }
            if (manifest.getPages() == null) {
                manifest.setPages(new ArrayList<>());
            } else if (manifest.getPages().contains(null)) {
                throw new DocVerifyException("Manifest " + path + " contains a null page entry");
            }
            log.info("Loaded manifest from {} ({} pages)", path, manifest.getPages().size());
            return Optional.of(manifest);
        } catch (IOException e) {
            throw new DocVerifyException("Could not parse manifest at " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws DocVerifyException if the directory cannot be created or the file cannot be written.
     */
    @Override
    public synchronized void save(AssertionManifest manifest, Path path) {
        Path target = path.toAbsolutePath();
        Path tempFile = null;
        try {
            Path parentDir = target.getParent();
            Files.createDirectories(parentDir);
            tempFile = Files.createTempFile(parentDir, target.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), manifest);
            moveIntoPlace(tempFile, target);
            log.info("Saved manifest to {} ({} pages)", path,
                    manifest.getPages() == null ? 0 : manifest.getPages().size());
        } catch (IOException e) {
            log.error("Failed to save manifest to {}", path, e);
            throw new DocVerifyException("Failed to save manifest to " + path, e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", tempFile, e);
        }
    }
}
