package com.docverify.service.api;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.model.UiTest;

/**
 * Decides whether what the browser shows satisfies a natural-language verification instruction.
 */
public interface UiVerifier {

    LlmVerdict verify(UiTest test, String url, String title, String visibleText);
}
