package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.ApiTest;
import com.docverify.model.Assertion;
import com.docverify.model.AssertionManifest;
import com.docverify.model.PageAssertions;
import com.docverify.model.Severity;
import com.docverify.model.SqlTest;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileManifestStoreTest {

    @TempDir
    Path tempDir;

    private FileManifestStore store;

    @BeforeEach
    void setUp() {
        store = new FileManifestStore(Jackson2ObjectMapperBuilder.json()
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS).build());
    }

    @Test
    void load_shouldReturnEmptyWhenNothingWasSaved() {
        assertThat(store.load(tempDir.resolve("assertions.json"))).isEmpty();
    }

    @Test
    void save_shouldPersistManifestThatLoadsBackEqual() {
        Path path = tempDir.resolve("nested/dir/assertions.json");
        Assertion api = new Assertion("agents-01", "Unauthenticated listing is rejected", Severity.CRITICAL,
                new ApiTest("GET", "/api/v1/devices", null, null,
                        new ApiTest.Expectation(401, null, null, null, null)));
        Assertion sql = new Assertion("agents-02", "New sites start with no devices", Severity.INFO,
                new SqlTest("devices of site {siteId}", "zero rows"));
        AssertionManifest manifest = new AssertionManifest(1, Instant.parse("2026-01-02T03:04:05Z"),
                List.of(new PageAssertions("agents/intro.mdx", "sha256:abc", List.of(api, sql))));

        store.save(manifest, path);
        Optional<AssertionManifest> loaded = store.load(path);

        assertThat(loaded).contains(manifest);
    }

    @Test
    void save_shouldReplaceExistingFileAndLeaveNoTemporaryFiles() throws Exception {
        Path path = tempDir.resolve("assertions.json");
        store.save(AssertionManifest.empty(), path);
        AssertionManifest second = new AssertionManifest(1, Instant.now(),
                List.of(new PageAssertions("features/alerts.md", "sha256:def", List.of())));

        store.save(second, path);

        assertThat(store.load(path).orElseThrow().getPages()).extracting(PageAssertions::getSource)
                .containsExactly("features/alerts.md");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(path);
        }
    }

    @Test
    void load_shouldFailOnCorruptManifest() throws Exception {
        Path path = tempDir.resolve("assertions.json");
        Files.writeString(path, "{ not json");

        assertThatThrownBy(() -> store.load(path))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("Could not parse manifest");
    }

    @Test
    void load_shouldRejectNewerManifestVersion() throws Exception {
        Path path = tempDir.resolve("assertions.json");
        Files.writeString(path, "{\"version\": 2, \"pages\": []}");

        assertThatThrownBy(() -> store.load(path))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("version 2");
    }

    @Test
    void load_shouldTreatNullPagesAsEmpty() throws Exception {
        Path path = tempDir.resolve("assertions.json");
        Files.writeString(path, "{\"version\": 1, \"generatedAt\": \"2026-01-02T03:04:05Z\", \"pages\": null}");

        AssertionManifest manifest = store.load(path).orElseThrow();

        assertThat(manifest.getPages()).isEmpty();
    }

    @Test
    void load_shouldRejectNullPageEntry() throws Exception {
        Path path = tempDir.resolve("assertions.json");
        Files.writeString(path, "{\"version\": 1, \"pages\": [null]}");

        assertThatThrownBy(() -> store.load(path))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("null page entry");
    }
}
