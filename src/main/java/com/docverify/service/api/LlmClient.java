package com.docverify.service.api;

/**
 * Minimal chat-completions client shared by claim extraction, sql planning and ui verification.
 */
public interface LlmClient {

    /**
     * @param systemPrompt Instructions.
     * @param userPrompt   The material to work on.
     * @param jsonObject   Ask the model to answer with a single JSON object.
     * @return The content of the first choice.
     */
    String complete(String systemPrompt, String userPrompt, boolean jsonObject);
}
