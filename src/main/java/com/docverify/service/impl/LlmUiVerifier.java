package com.docverify.service.impl;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.exception.DocVerifyException;
import com.docverify.model.UiTest;
import com.docverify.service.api.LlmClient;
import com.docverify.service.api.UiVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Judges a rendered page by its URL, title and visible text.
 */
@Service
@Slf4j
public class LlmUiVerifier implements UiVerifier {

    static final String SYSTEM_PROMPT = """
            You verify claims that product documentation makes about a web application's UI.
            You get the page the browser ended up on (URL, title and visible text) and a statement of what \
            should be visible. Decide whether the page satisfies the statement. Judge only from the text given; \
            if the page shows an error, a spinner or an empty state where content is expected, the claim fails.
            Respond with ONLY a JSON object: {"pass": true|false, "reason": "one sentence"}
            """;

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    @Value("${docverify.ui.max-page-text:12000}")
    private int maxPageText;

    public LlmUiVerifier(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public LlmVerdict verify(UiTest test, String url, String title, String visibleText) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Should be visible: ").append(test.verify()).append("\n\n");
        if (test.setup() != null && !test.setup().isEmpty()) {
            prompt.append("Steps a user takes before looking:\n");
            test.setup().forEach(step -> prompt.append("- ").append(step).append('\n'));
            prompt.append('\n');
        }
        prompt.append("URL: ").append(url).append('\n');
        prompt.append("Title: ").append(title).append("\n\n");
        prompt.append("Visible text:\n").append(TargetUrls.truncate(visibleText, maxPageText));

        String content = llmClient.complete(SYSTEM_PROMPT, prompt.toString(), true);
        try {
            return objectMapper.readValue(AssertionResponseParser.stripCodeFence(content), LlmVerdict.class);
        } catch (JsonProcessingException e) {
            throw new DocVerifyException("LLM answer is not a valid verdict: " + e.getOriginalMessage(), e);
        }
    }
}
