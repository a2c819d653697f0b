package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one run. Counts are always derived from {@code results}, so
 * {@code total == passed + failed + skipped + errors == results.size()} holds by construction.
 */
@JsonPropertyOrder({"startedAt", "completedAt", "total", "passed", "failed", "skipped", "errors", "results"})
public record RunReport(Instant startedAt,
                        Instant completedAt,
                        int total,
                        int passed,
                        int failed,
                        int skipped,
                        int errors,
                        List<AssertionResult> results) {

    public static RunReport of(Instant startedAt, Instant completedAt, List<AssertionResult> results) {
        List<AssertionResult> copy = List.copyOf(results);
        return new RunReport(startedAt, completedAt, copy.size(),
                count(copy, AssertionStatus.PASS),
                count(copy, AssertionStatus.FAIL),
                count(copy, AssertionStatus.SKIP),
                count(copy, AssertionStatus.ERROR),
                copy);
    }

    private static int count(List<AssertionResult> results, AssertionStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    /**
     * @return Whether the run should exit zero. Skips never count against a run.
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return failed == 0 && errors == 0;
    }

    /**
     * @return Passed over executed (total minus skipped) as a percentage, or 0 when nothing executed.
     */
    @JsonIgnore
    public double passRate() {
        int executed = total - skipped;
        return executed == 0 ? 0.0 : (passed * 100.0) / executed;
    }
}
