package com.docverify.service.api;

import com.docverify.model.Assertion;
import com.docverify.model.AssertionResult;
import com.docverify.model.EnvironmentContext;

/**
 * Runs one kind of assertion against a live target.
 * <p>
 * Implementations return {@code pass}, {@code fail} or {@code skip}. Anything unexpected is thrown; the runner
 * turns it into an {@code error} result.
 */
public interface AssertionExecutor {

    /**
     * @param assertion      The assertion to check.
     * @param targetLocation API base URL, database target or UI base URL, depending on the kind.
     * @param environment    Read-only context shared by the whole run.
     * @return The outcome. Timing is filled in by the runner.
     */
    AssertionResult execute(Assertion assertion, String targetLocation, EnvironmentContext environment);
}
