package com.docverify.config;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Where the deployment under test lives and where documentation, manifest and reports are kept.
 * Every value comes from {@code application.properties}, which maps it to an environment variable with a
 * default suited to a local development stack.
 */
@Component
@Getter
public class TargetSettings {

    @Value("${docverify.api-url}")
    private String apiUrl;

    @Value("${docverify.ui-url}")
    private String uiUrl;

    @Value("${docverify.database-url}")
    private String databaseUrl;

    @Value("${docverify.admin.email}")
    private String adminEmail;

    @Value("${docverify.admin.password}")
    private String adminPassword;

    @Value("${docverify.enrollment-secret}")
    private String enrollmentSecret;

    @Value("${docverify.docs.root}")
    private String docsRoot;

    @Value("${docverify.docs.scope}")
    private String[] docsScope;

    @Value("${docverify.manifest-path}")
    private String manifestPath;

    @Value("${docverify.report-dir}")
    private String reportDir;

    public List<String> getScopeDirs() {
        return Arrays.stream(docsScope).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public Path manifestFile() {
        return Path.of(manifestPath);
    }

    public Path jsonReportFile() {
        return Path.of(reportDir, "report.json");
    }

    public Path htmlReportFile() {
        return Path.of(reportDir, "report.html");
    }
}
