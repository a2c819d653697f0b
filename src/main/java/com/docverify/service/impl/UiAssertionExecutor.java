package com.docverify.service.impl;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.model.Assertion;
import com.docverify.model.AssertionResult;
import com.docverify.model.EnvironmentContext;
import com.docverify.model.UiTest;
import com.docverify.service.api.AssertionExecutor;
import com.docverify.service.api.BrowserSession;
import com.docverify.service.api.UiVerifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks ui claims in the browser session of the current run. Created per run, because it is bound to that
 * run's session.
 */
@Slf4j
class UiAssertionExecutor implements AssertionExecutor {

    private static final String LOGIN_PATH = "/login";

    private final BrowserSession session;
    private final UiVerifier uiVerifier;

    UiAssertionExecutor(BrowserSession session, UiVerifier uiVerifier) {
        this.session = session;
        this.uiVerifier = uiVerifier;
    }

    @Override
    public AssertionResult execute(Assertion assertion, String uiBaseUrl, EnvironmentContext environment) {
        if (!(assertion.getTest() instanceof UiTest test)) {
            throw new IllegalArgumentException("Assertion " + assertion.getId() + " is not a ui assertion");
        }

        String target = environment.resolve(test.navigate());
        String url = TargetUrls.join(uiBaseUrl, target);
        session.navigate(url);

        String landedOn = session.currentUrl();
        if (landedOn != null && landedOn.contains(LOGIN_PATH) && !target.startsWith(LOGIN_PATH)) {
            return AssertionResult.skip(assertion, "redirected to login, browser session is not authenticated");
        }

        LlmVerdict verdict = uiVerifier.verify(test, landedOn, session.title(), session.visibleText());
        if (verdict.pass()) {
            return AssertionResult.pass(assertion);
        }
        return AssertionResult.fail(assertion, verdict.reason() + " [" + landedOn + "]");
    }
}
