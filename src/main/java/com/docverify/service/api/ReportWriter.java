package com.docverify.service.api;

import com.docverify.model.RunReport;
import java.nio.file.Path;

public interface ReportWriter {

    /**
     * Prints counts and pass rate to the console.
     */
    void printSummary(RunReport report);

    void saveJsonReport(RunReport report, Path path);

    void saveHtmlReport(RunReport report, Path path);
}
