package com.docverify.cli;

import com.docverify.dto.response.CommandResponse;
import com.docverify.exception.ManifestNotFoundException;
import com.docverify.model.AssertionKind;
import com.docverify.model.AssertionManifest;
import com.docverify.model.RunReport;
import com.docverify.service.impl.ConformanceWorkflow;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for checking the documentation against a running deployment. Meant to be run
 * non-interactively, e.g. {@code java -jar doc-verify.jar run --type api}; the process exit code is
 * non-zero when a command fails or any assertion fails or errors.
 */
@ShellComponent
@Slf4j
public class ConformanceCommands {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_PURPLE = "\u001B[35m";

    private final ConformanceWorkflow workflow;
    private final ExitStatus exitStatus;

    public ConformanceCommands(ConformanceWorkflow workflow, ExitStatus exitStatus) {
        this.workflow = workflow;
        this.exitStatus = exitStatus;
    }

    /**
     * Derives assertions from the documentation pages in scope and writes the manifest.
     *
     * @param incremental Only send pages whose content changed since the last extraction.
     * @param page        Restrict extraction to pages whose path contains this text.
     * @param verbose     Debug logging for the duration of the command.
     * @return The outcome line.
     */
    @ShellMethod(key = "extract", value = "Extracts assertions from the documentation into the manifest.")
    public String extract(
            @ShellOption(value = {"--incremental", "-i"}, help = "Skip pages whose content has not changed.", defaultValue = "false", arity = 0) boolean incremental,
            @ShellOption(value = {"--page", "-p"}, help = "Only pages whose path contains this text.", defaultValue = ShellOption.NULL) String page,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return withLogging(verbose, () -> {
            AssertionManifest manifest = workflow.extract(incremental, page);
            return succeed("Extracted " + countAssertions(manifest) + " assertions from "
                    + manifest.getPages().size() + " pages.");
        });
    }

    /**
     * Runs the manifest against the deployment and writes the reports.
     *
     * @param page    Restrict the run to pages whose path contains this text.
     * @param type    Restrict the run to one assertion type: api, sql or ui.
     * @param verbose Debug logging for the duration of the command.
     * @return The outcome line.
     */
    @ShellMethod(key = "run", value = "Runs the extracted assertions against the deployment.")
    public String run(
            @ShellOption(value = {"--page", "-p"}, help = "Only pages whose path contains this text.", defaultValue = ShellOption.NULL) String page,
            @ShellOption(value = {"--type", "-t"}, help = "Only assertions of this type (api, sql or ui).", defaultValue = ShellOption.NULL) String type,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return withLogging(verbose, () -> report(workflow.run(page, kind(type))));
    }

    /**
     * Extracts, then runs.
     */
    @ShellMethod(key = "all", value = "Extracts assertions, then runs them against the deployment.")
    public String all(
            @ShellOption(value = {"--incremental", "-i"}, help = "Skip pages whose content has not changed.", defaultValue = "false", arity = 0) boolean incremental,
            @ShellOption(value = {"--page", "-p"}, help = "Only pages whose path contains this text.", defaultValue = ShellOption.NULL) String page,
            @ShellOption(value = {"--type", "-t"}, help = "Only assertions of this type (api, sql or ui).", defaultValue = ShellOption.NULL) String type,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return withLogging(verbose, () -> {
            AssertionKind kind = kind(type);
            workflow.extract(incremental, page);
            return report(workflow.run(page, kind));
        });
    }

    private String report(RunReport report) {
        String summary = report.passed() + " passed, " + report.failed() + " failed, " + report.skipped()
                + " skipped, " + report.errors() + " errors.";
        if (report.isSuccessful()) {
            return succeed("Documentation verified: " + summary);
        }
        return fail("Documentation does not match the deployment: " + summary);
    }

    private String withLogging(boolean verbose, Supplier<String> command) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }
        try {
            return command.get();
        } catch (ManifestNotFoundException | IllegalArgumentException e) {
            return fail(e.getMessage());
        } catch (Exception e) {
            log.error("Command failed", e);
            return fail("An error occurred: " + e.getMessage());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }

    private static AssertionKind kind(String type) {
        return type == null ? null : AssertionKind.fromCode(type);
    }

    private static int countAssertions(AssertionManifest manifest) {
        return manifest.getPages().stream()
                .mapToInt(p -> p.getAssertions() == null ? 0 : p.getAssertions().size())
                .sum();
    }

    private String succeed(String message) {
        exitStatus.set(0);
        return new CommandResponse(true, message).toAnsiString();
    }

    private String fail(String message) {
        exitStatus.set(1);
        return new CommandResponse(false, message).toAnsiString();
    }
}
