package com.docverify.service.impl;

import com.docverify.model.Assertion;
import com.docverify.model.AssertionManifest;
import com.docverify.model.PageAssertions;
import com.docverify.service.api.ClaimExtractionService;
import com.docverify.service.api.DocumentationScanner;
import com.docverify.service.api.ExtractionCoordinator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks documentation pages and (re)derives their assertions.
 * <p>
 * The content hash is the only thing deciding whether a page is sent to the extraction service again. A claim
 * whose meaning changed without any byte of the page changing is not re-extracted; that is accepted in
 * exchange for cheap, deterministic runs and stable assertion ids.
 */
@Service
@Slf4j
public class ExtractionCoordinatorImpl implements ExtractionCoordinator {

    private final DocumentationScanner documentationScanner;
    private final ClaimExtractionService claimExtractionService;
    private final AssertionResponseParser responseParser;

    public ExtractionCoordinatorImpl(DocumentationScanner documentationScanner,
                                     ClaimExtractionService claimExtractionService,
                                     AssertionResponseParser responseParser) {
        this.documentationScanner = documentationScanner;
        this.claimExtractionService = claimExtractionService;
        this.responseParser = responseParser;
    }

    @Override
    public AssertionManifest extract(List<String> pages, AssertionManifest priorManifest, boolean incremental) {
        return extract(pages, priorManifest, incremental, null);
    }

    @Override
    public AssertionManifest extract(List<String> pages, AssertionManifest priorManifest, boolean incremental,
                                     String pageFilter) {
        Map<String, PageAssertions> priorPages = indexBySource(priorManifest);
        List<PageAssertions> result = new ArrayList<>(pages.size());
        int reused = 0;
        int extracted = 0;
        int failed = 0;

        for (String source : pages) {
            PageAssertions previous = priorPages.get(source);

            if (pageFilter != null && !source.contains(pageFilter)) {
                if (previous != null) {
                    result.add(previous);
                }
                continue;
            }

            String text = readPage(source);
            if (text == null) {
                // an unreadable page keeps its prior entry
                if (previous != null) {
                    result.add(previous);
                }
                failed++;
                continue;
            }
            String contentHash = ContentHash.of(text);

            if (incremental && previous != null && contentHash.equals(previous.getContentHash())) {
                log.info("[skip] {} (unchanged)", source);
                result.add(previous);
                reused++;
                continue;
            }

            log.info("[extract] {}", source);
            List<Assertion> assertions = extractPage(source, text);
            if (assertions == null) {
                assertions = new ArrayList<>();
                failed++;
            } else {
                extracted++;
                logRetiredIds(source, previous, assertions);
                log.info("  {} assertions", assertions.size());
            }
            result.add(new PageAssertions(source, contentHash, assertions));
        }

        log.info("Extraction complete: {} extracted, {} unchanged, {} failed", extracted, reused, failed);
        return new AssertionManifest(AssertionManifest.CURRENT_VERSION, Instant.now(), result);
    }

    private String readPage(String source) {
        try {
            return documentationScanner.readPage(source);
        } catch (RuntimeException e) {
            log.warn("[warn] {}: could not read page ({})", source, e.getMessage());
            log.debug("Read failure for {}", source, e);
            return null;
        }
    }

    /**
     * @return The page's assertions, or {@code null} if the service failed or answered with something that is
     *         not a well-formed assertion list.
     */
    private List<Assertion> extractPage(String source, String text) {
        try {
            String response = claimExtractionService.extractClaims(source, text);
            return new ArrayList<>(responseParser.parse(response));
        } catch (RuntimeException e) {
            log.warn("[warn] {}: could not extract assertions, recording none ({})", source, e.getMessage());
            log.debug("Extraction failure for {}", source, e);
            return null;
        }
    }

    private void logRetiredIds(String source, PageAssertions previous, List<Assertion> assertions) {
        if (previous == null || previous.getAssertions() == null) {
            return;
        }
        Set<String> current = assertions.stream().map(Assertion::getId).collect(Collectors.toSet());
        Set<String> retired = previous.getAssertions().stream()
                .map(Assertion::getId)
                .filter(id -> !current.contains(id))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!retired.isEmpty()) {
            log.info("  {}: ids no longer present after re-extraction: {}", source, retired);
        }
    }

    private static Map<String, PageAssertions> indexBySource(AssertionManifest manifest) {
        Map<String, PageAssertions> index = new LinkedHashMap<>();
        if (manifest == null || manifest.getPages() == null) {
            return index;
        }
        for (PageAssertions page : manifest.getPages()) {
            index.putIfAbsent(page.getSource(), page);
        }
        return index;
    }
}
