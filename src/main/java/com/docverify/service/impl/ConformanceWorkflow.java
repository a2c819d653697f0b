package com.docverify.service.impl;

import com.docverify.config.TargetSettings;
import com.docverify.exception.ManifestNotFoundException;
import com.docverify.model.AssertionKind;
import com.docverify.model.AssertionManifest;
import com.docverify.model.EnvironmentContext;
import com.docverify.model.RunOptions;
import com.docverify.model.RunReport;
import com.docverify.model.SeededFixtures;
import com.docverify.service.api.AssertionRunner;
import com.docverify.service.api.DocumentationScanner;
import com.docverify.service.api.ExtractionCoordinator;
import com.docverify.service.api.FixtureSeeder;
import com.docverify.service.api.ManifestStore;
import com.docverify.service.api.ReportWriter;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The two top-level flows behind the shell commands: refresh the manifest from the documentation, and run it
 * against the configured deployment.
 */
@Service
@Slf4j
public class ConformanceWorkflow {

    private final TargetSettings settings;
    private final DocumentationScanner documentationScanner;
    private final ExtractionCoordinator extractionCoordinator;
    private final ManifestStore manifestStore;
    private final FixtureSeeder fixtureSeeder;
    private final AssertionRunner assertionRunner;
    private final ReportWriter reportWriter;

    public ConformanceWorkflow(TargetSettings settings,
                               DocumentationScanner documentationScanner,
                               ExtractionCoordinator extractionCoordinator,
                               ManifestStore manifestStore,
                               FixtureSeeder fixtureSeeder,
                               AssertionRunner assertionRunner,
                               ReportWriter reportWriter) {
        this.settings = settings;
        this.documentationScanner = documentationScanner;
        this.extractionCoordinator = extractionCoordinator;
        this.manifestStore = manifestStore;
        this.fixtureSeeder = fixtureSeeder;
        this.assertionRunner = assertionRunner;
        this.reportWriter = reportWriter;
    }

    /**
     * Extracts assertions from the documentation in scope and persists the manifest.
     *
     * @param incremental Reuse assertions of pages whose content hash did not change.
     * @param pageFilter  Only (re)extract pages whose source contains this, or {@code null}.
     */
    public AssertionManifest extract(boolean incremental, String pageFilter) {
        Path manifestFile = settings.manifestFile();
        // A filtered extraction must keep the other pages, so it needs the prior manifest too.
        AssertionManifest prior = incremental || pageFilter != null
                ? manifestStore.load(manifestFile).orElse(null)
                : null;

        List<String> pages = documentationScanner.listPages(settings.getScopeDirs());
        log.info("Found {} documentation pages", pages.size());

        AssertionManifest manifest = extractionCoordinator.extract(pages, prior, incremental, pageFilter);
        manifestStore.save(manifest, manifestFile);
        log.info("Manifest written to {}", manifestFile);
        return manifest;
    }

    /**
     * Seeds fixtures, runs the persisted manifest and writes the reports.
     *
     * @throws ManifestNotFoundException if nothing has been extracted yet. Nothing is seeded in that case.
     */
    public RunReport run(String pageFilter, AssertionKind kindFilter) {
        Path manifestFile = settings.manifestFile();
        AssertionManifest manifest = manifestStore.load(manifestFile)
                .orElseThrow(() -> new ManifestNotFoundException(manifestFile));

        SeededFixtures fixtures = fixtureSeeder.seed(settings.getApiUrl());
        String token = fixtureSeeder.authenticate(settings.getApiUrl(), fixtures.adminEmail(), fixtures.adminPassword());
        EnvironmentContext environment = EnvironmentContext.from(fixtures, token, settings.getEnrollmentSecret());

        RunOptions options = new RunOptions(settings.getApiUrl(), settings.getUiUrl(), settings.getDatabaseUrl(),
                environment, pageFilter, kindFilter);
        RunReport report = assertionRunner.run(manifest, options);

        reportWriter.printSummary(report);
        reportWriter.saveJsonReport(report, settings.jsonReportFile());
        reportWriter.saveHtmlReport(report, settings.htmlReportFile());
        return report;
    }
}
