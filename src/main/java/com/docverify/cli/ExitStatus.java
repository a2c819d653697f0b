package com.docverify.cli;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Remembers the exit code of the last command so {@code SpringApplication.exit} can hand it to the JVM
 * once a non-interactive invocation finishes.
 */
@Component
public class ExitStatus implements ExitCodeGenerator {

    private volatile int exitCode;

    public void set(int exitCode) {
        this.exitCode = exitCode;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
