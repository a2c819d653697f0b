package com.docverify.service.impl;

import com.docverify.config.TargetSettings;
import com.docverify.exception.DocVerifyException;
import com.docverify.service.api.DocumentationScanner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Reads {@code .md} and {@code .mdx} pages that sit directly inside the configured scope directories of the
 * documentation root.
 */
@Service
@Slf4j
public class FileSystemDocumentationScanner implements DocumentationScanner {

    private final Path docsRoot;

    @Autowired
    public FileSystemDocumentationScanner(TargetSettings settings) {
        this(Path.of(settings.getDocsRoot()));
    }

    FileSystemDocumentationScanner(Path docsRoot) {
        this.docsRoot = docsRoot;
    }

    @Override
    public List<String> listPages(List<String> scopeDirs) {
        List<String> pages = new ArrayList<>();
        for (String scopeDir : scopeDirs) {
            Path dir = docsRoot.resolve(scopeDir);
            if (!Files.isDirectory(dir)) {
                log.warn("Documentation directory {} does not exist, skipping", dir);
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(Files::isRegularFile)
                        .filter(FileSystemDocumentationScanner::isDocumentationPage)
                        .map(file -> file.getFileName().toString())
                        .sorted()
                        .forEach(name -> pages.add(scopeDir + "/" + name));
            } catch (IOException e) {
                throw new DocVerifyException("Could not list documentation directory " + dir, e);
            }
        }
        return pages;
    }

    @Override
    public String readPage(String source) {
        Path file = docsRoot.resolve(source);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocVerifyException("Could not read documentation page " + file, e);
        }
    }

    private static boolean isDocumentationPage(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".mdx") || name.endsWith(".md");
    }
}
