package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.AssertionResult;
import com.docverify.model.AssertionStatus;
import com.docverify.model.RunReport;
import com.docverify.service.api.ReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

@Service
@Slf4j
public class ReportWriterImpl implements ReportWriter {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String MAGENTA = "\u001B[35m";
    private static final String RESET = "\u001B[0m";

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public ReportWriterImpl(ObjectMapper objectMapper) {
        this(objectMapper, System.out);
    }

    ReportWriterImpl(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void printSummary(RunReport report) {
        out.println();
        out.println("Results: " + report.total() + " assertions");
        out.println("  " + GREEN + "passed:  " + report.passed() + RESET);
        out.println("  " + RED + "failed:  " + report.failed() + RESET);
        out.println("  " + YELLOW + "skipped: " + report.skipped() + RESET);
        out.println("  " + MAGENTA + "errors:  " + report.errors() + RESET);
        out.println(String.format(Locale.ROOT, "  pass rate: %.1f%%", report.passRate()));

        report.results().stream()
                .filter(r -> r.status() == AssertionStatus.FAIL || r.status() == AssertionStatus.ERROR)
                .forEach(r -> out.println("  " + RED + "[" + r.status().label() + "] " + RESET
                        + r.id() + ": " + r.reason()));
    }

    @Override
    public void saveJsonReport(RunReport report, Path path) {
        try {
            createParent(path);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
            log.info("JSON report written to {}", path);
        } catch (IOException e) {
            throw new DocVerifyException("Could not write JSON report to " + path, e);
        }
    }

    @Override
    public void saveHtmlReport(RunReport report, Path path) {
        try {
            createParent(path);
            Files.writeString(path, renderHtml(report), StandardCharsets.UTF_8);
            log.info("HTML report written to {}", path);
        } catch (IOException e) {
            throw new DocVerifyException("Could not write HTML report to " + path, e);
        }
    }

    String renderHtml(RunReport report) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n")
                .append("<title>Documentation verification report</title>\n")
                .append("<style>\n")
                .append("body{font-family:system-ui,sans-serif;margin:2rem;color:#1f2933}\n")
                .append("table{border-collapse:collapse;width:100%}\n")
                .append("th,td{border-bottom:1px solid #e4e7eb;padding:.4rem .6rem;text-align:left;vertical-align:top}\n")
                .append(".pass{color:#0f7b3f}.fail{color:#c81e1e}.skip{color:#9a6700}.error{color:#8e24aa}\n")
                .append("</style>\n</head>\n<body>\n");

        html.append("<h1>Documentation verification report</h1>\n")
                .append("<p>Started ").append(escape(String.valueOf(report.startedAt())))
                .append(", completed ").append(escape(String.valueOf(report.completedAt()))).append("</p>\n")
                .append("<p>Total ").append(report.total())
                .append(" &middot; <span class=\"pass\">passed ").append(report.passed()).append("</span>")
                .append(" &middot; <span class=\"fail\">failed ").append(report.failed()).append("</span>")
                .append(" &middot; <span class=\"skip\">skipped ").append(report.skipped()).append("</span>")
                .append(" &middot; <span class=\"error\">errors ").append(report.errors()).append("</span>")
                .append(String.format(Locale.ROOT, " &middot; pass rate %.1f%%", report.passRate()))
                .append("</p>\n");

        html.append("<table>\n<thead><tr><th>Status</th><th>Id</th><th>Page</th><th>Type</th><th>Severity</th>")
                .append("<th>Claim</th><th>Reason</th><th>ms</th></tr></thead>\n<tbody>\n");
        for (AssertionResult result : report.results()) {
            String status = result.status().label();
            html.append("<tr><td class=\"").append(status).append("\">").append(status).append("</td>")
                    .append("<td>").append(escape(result.id())).append("</td>")
                    .append("<td>").append(escape(result.source())).append("</td>")
                    .append("<td>").append(result.kind() == null ? "" : result.kind().code()).append("</td>")
                    .append("<td>").append(result.severity() == null ? "" : escape(result.severity().name().toLowerCase(Locale.ROOT))).append("</td>")
                    .append("<td>").append(escape(result.claim())).append("</td>")
                    .append("<td>").append(escape(result.reason())).append("</td>")
                    .append("<td>").append(result.durationMs()).append("</td></tr>\n");
        }
        html.append("</tbody>\n</table>\n</body>\n</html>\n");
        return html.toString();
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
