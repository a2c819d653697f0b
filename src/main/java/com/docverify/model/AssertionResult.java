package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One executed outcome. Carries the claim and page so a report can be read without the manifest.
 */
@JsonPropertyOrder({"id", "source", "kind", "severity", "claim", "status", "reason", "durationMs"})
public record AssertionResult(String id,
                              String source,
                              AssertionKind kind,
                              Severity severity,
                              String claim,
                              AssertionStatus status,
                              String reason,
                              long durationMs) {

    public static AssertionResult pass(Assertion assertion) {
        return of(assertion, AssertionStatus.PASS, "");
    }

    public static AssertionResult fail(Assertion assertion, String reason) {
        return of(assertion, AssertionStatus.FAIL, reason);
    }

    public static AssertionResult skip(Assertion assertion, String reason) {
        return of(assertion, AssertionStatus.SKIP, reason);
    }

    public static AssertionResult error(Assertion assertion, String reason) {
        return of(assertion, AssertionStatus.ERROR, reason);
    }

    private static AssertionResult of(Assertion assertion, AssertionStatus status, String reason) {
        return new AssertionResult(assertion.getId(), null, assertion.getKind(), assertion.getSeverity(),
                assertion.getClaim(), status, reason == null ? "" : reason, 0L);
    }

    /**
     * Stamps the page and measured duration. The runner owns timing, executors do not.
     */
    public AssertionResult withTiming(String pageSource, long elapsedMs) {
        return new AssertionResult(id, pageSource, kind, severity, claim, status, reason, elapsedMs);
    }
}
