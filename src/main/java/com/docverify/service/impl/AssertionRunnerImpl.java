package com.docverify.service.impl;

import com.docverify.model.Assertion;
import com.docverify.model.AssertionKind;
import com.docverify.model.AssertionManifest;
import com.docverify.model.AssertionResult;
import com.docverify.model.PageAssertions;
import com.docverify.model.RunOptions;
import com.docverify.model.RunReport;
import com.docverify.service.api.AssertionExecutor;
import com.docverify.service.api.AssertionRunner;
import com.docverify.service.api.BrowserSession;
import com.docverify.service.api.BrowserSessionFactory;
import com.docverify.service.api.UiVerifier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the selected assertions one at a time, in manifest order, and folds the outcomes into a report.
 * <p>
 * A browser is started only when a ui assertion is selected, and shut down whatever happens in the loop.
 */
@Service
@Slf4j
public class AssertionRunnerImpl implements AssertionRunner {

    private static final int CLAIM_PREVIEW_LENGTH = 80;

    private final ApiAssertionExecutor apiAssertionExecutor;
    private final SqlAssertionExecutor sqlAssertionExecutor;
    private final BrowserSessionFactory browserSessionFactory;
    private final UiVerifier uiVerifier;

    public AssertionRunnerImpl(ApiAssertionExecutor apiAssertionExecutor,
                               SqlAssertionExecutor sqlAssertionExecutor,
                               BrowserSessionFactory browserSessionFactory,
                               UiVerifier uiVerifier) {
        this.apiAssertionExecutor = apiAssertionExecutor;
        this.sqlAssertionExecutor = sqlAssertionExecutor;
        this.browserSessionFactory = browserSessionFactory;
        this.uiVerifier = uiVerifier;
    }

    @Override
    public RunReport run(AssertionManifest manifest, RunOptions options) {
        Instant startedAt = Instant.now();
        List<Selected> selected = select(manifest, options);
        log.info("Running {} assertions", selected.size());

        List<AssertionResult> results = new ArrayList<>(selected.size());
        BrowserSession session = null;
        try {
            Map<AssertionKind, AssertionExecutor> executors = new EnumMap<>(AssertionKind.class);
            executors.put(AssertionKind.API, apiAssertionExecutor);
            executors.put(AssertionKind.SQL, sqlAssertionExecutor);

            if (selected.stream().anyMatch(s -> s.assertion().getKind() == AssertionKind.UI)) {
                try {
                    session = browserSessionFactory.open(options.uiBaseUrl(), options.environment());
                    executors.put(AssertionKind.UI, new UiAssertionExecutor(session, uiVerifier));
                } catch (RuntimeException e) {
                    String reason = "browser unavailable: " + e.getMessage();
                    log.warn("Could not start the browser, ui assertions will be skipped ({})", e.getMessage());
                    executors.put(AssertionKind.UI, (assertion, target, environment) ->
                            AssertionResult.skip(assertion, reason));
                }
            }

            for (Selected item : selected) {
                AssertionResult result = runOne(item, executors, options);
                results.add(result);
                logResult(result);
            }
        } finally {
            if (session != null) {
                session.close();
            }
        }

        return RunReport.of(startedAt, Instant.now(), results);
    }

    private AssertionResult runOne(Selected item, Map<AssertionKind, AssertionExecutor> executors,
                                   RunOptions options) {
        Assertion assertion = item.assertion();
        long start = System.nanoTime();
        AssertionResult result;
        try {
            AssertionKind kind = assertion.getKind();
            AssertionExecutor executor = executors.get(kind);
            if (executor == null) {
                result = AssertionResult.error(assertion, "no executor for assertion type " + kind);
            } else {
                result = executor.execute(assertion, targetFor(kind, options), options.environment());
            }
        } catch (Exception | LinkageError | StackOverflowError | AssertionError e) {
            // errors that leave the JVM usable stay local to the assertion; OutOfMemoryError and the like propagate
            log.debug("Assertion {} raised", assertion.getId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = AssertionResult.error(assertion, message);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return result.withTiming(item.source(), elapsedMs);
    }

    private static String targetFor(AssertionKind kind, RunOptions options) {
        return switch (kind) {
            case API -> options.apiBaseUrl();
            case SQL -> options.databaseUrl();
            case UI -> options.uiBaseUrl();
        };
    }

    static List<Selected> select(AssertionManifest manifest, RunOptions options) {
        List<Selected> selected = new ArrayList<>();
        if (manifest.getPages() == null) {
            return selected;
        }
        for (PageAssertions page : manifest.getPages()) {
            if (options.pageFilter() != null && !page.getSource().contains(options.pageFilter())) {
                continue;
            }
            if (page.getAssertions() == null) {
                continue;
            }
            for (Assertion assertion : page.getAssertions()) {
                if (options.kindFilter() == null || assertion.getKind() == options.kindFilter()) {
                    selected.add(new Selected(page.getSource(), assertion));
                }
            }
        }
        return selected;
    }

    private static void logResult(AssertionResult result) {
        String line = String.format("[%s] %s %s (%dms)", result.status().label(), result.id(),
                TargetUrls.truncate(result.claim(), CLAIM_PREVIEW_LENGTH), result.durationMs());
        if (result.reason() == null || result.reason().isEmpty()) {
            log.info("{}", line);
        } else {
            log.info("{}\n       {}", line, result.reason());
        }
    }

    record Selected(String source, Assertion assertion) {
    }
}
