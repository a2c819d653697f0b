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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConformanceWorkflowTest {

    @Mock
    private DocumentationScanner documentationScanner;
    @Mock
    private ExtractionCoordinator extractionCoordinator;
    @Mock
    private ManifestStore manifestStore;
    @Mock
    private FixtureSeeder fixtureSeeder;
    @Mock
    private AssertionRunner assertionRunner;
    @Mock
    private ReportWriter reportWriter;

    private final TargetSettings settings = new TargetSettings();
    private ConformanceWorkflow workflow;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(settings, "apiUrl", "http://api.test");
        ReflectionTestUtils.setField(settings, "uiUrl", "http://ui.test");
        ReflectionTestUtils.setField(settings, "databaseUrl", "");
        ReflectionTestUtils.setField(settings, "enrollmentSecret", "enroll-secret");
        ReflectionTestUtils.setField(settings, "docsScope", new String[]{"agents", " features "});
        ReflectionTestUtils.setField(settings, "manifestPath", "out/assertions.json");
        ReflectionTestUtils.setField(settings, "reportDir", "out/reports");
        workflow = new ConformanceWorkflow(settings, documentationScanner, extractionCoordinator, manifestStore,
                fixtureSeeder, assertionRunner, reportWriter);
    }

    @Test
    void run_withoutManifest_shouldFailBeforeSeedingOrRunning() {
        when(manifestStore.load(Path.of("out/assertions.json"))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> workflow.run(null, null))
                .isInstanceOf(ManifestNotFoundException.class)
                .hasMessageContaining("Run 'extract' first");
        verifyNoInteractions(fixtureSeeder, assertionRunner, reportWriter);
    }

    @Test
    void run_shouldSeedAuthenticateRunAndWriteBothReports() {
        // --- Arrange ---
        AssertionManifest manifest = AssertionManifest.empty();
        RunReport report = RunReport.of(Instant.EPOCH, Instant.EPOCH, List.of());
        when(manifestStore.load(any())).thenReturn(Optional.of(manifest));
        when(fixtureSeeder.seed("http://api.test"))
                .thenReturn(new SeededFixtures("org-1", "site-1", "ek", "admin@docverify.local", "pw"));
        when(fixtureSeeder.authenticate("http://api.test", "admin@docverify.local", "pw")).thenReturn("tok-1");
        when(assertionRunner.run(any(), any())).thenReturn(report);

        // --- Act ---
        RunReport result = workflow.run("agents", AssertionKind.API);

        // --- Assert ---
        assertThat(result).isSameAs(report);
        ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
        verify(assertionRunner).run(same(manifest), options.capture());
        assertThat(options.getValue().pageFilter()).isEqualTo("agents");
        assertThat(options.getValue().kindFilter()).isEqualTo(AssertionKind.API);
        assertThat(options.getValue().environment().get(EnvironmentContext.AUTH_TOKEN)).contains("tok-1");
        assertThat(options.getValue().environment().get(EnvironmentContext.ENROLLMENT_SECRET)).contains("enroll-secret");
        verify(reportWriter).printSummary(report);
        verify(reportWriter).saveJsonReport(report, Path.of("out/reports", "report.json"));
        verify(reportWriter).saveHtmlReport(report, Path.of("out/reports", "report.html"));
    }

    @Test
    void extract_full_shouldNotLoadPriorManifest() {
        AssertionManifest extracted = AssertionManifest.empty();
        when(documentationScanner.listPages(List.of("agents", "features"))).thenReturn(List.of("agents/intro.mdx"));
        when(extractionCoordinator.extract(List.of("agents/intro.mdx"), null, false, null)).thenReturn(extracted);

        AssertionManifest result = workflow.extract(false, null);

        assertThat(result).isSameAs(extracted);
        verify(manifestStore, never()).load(any());
        verify(manifestStore).save(extracted, Path.of("out/assertions.json"));
    }

    @Test
    void extract_incremental_shouldPassPriorManifest() {
        AssertionManifest prior = AssertionManifest.empty();
        AssertionManifest extracted = AssertionManifest.empty();
        when(manifestStore.load(any())).thenReturn(Optional.of(prior));
        when(documentationScanner.listPages(any())).thenReturn(List.of("agents/intro.mdx"));
        when(extractionCoordinator.extract(List.of("agents/intro.mdx"), prior, true, null)).thenReturn(extracted);

        workflow.extract(true, null);

        verify(manifestStore).save(extracted, Path.of("out/assertions.json"));
    }
}
