package com.docverify.exception;

import java.nio.file.Path;

/**
 * Raised when assertions are about to run but no manifest has ever been extracted.
 */
public class ManifestNotFoundException extends DocVerifyException {

    private final Path path;

    public ManifestNotFoundException(Path path) {
        super("No assertions manifest found at " + path + ". Run 'extract' first.");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
