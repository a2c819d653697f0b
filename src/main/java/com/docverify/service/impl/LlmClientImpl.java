package com.docverify.service.impl;

import com.docverify.dto.llm.LlmMessage;
import com.docverify.dto.llm.LlmRequest;
import com.docverify.dto.llm.LlmResponse;
import com.docverify.exception.DocVerifyException;
import com.docverify.service.api.LlmClient;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Talks to an OpenAI-compatible chat-completions endpoint.
 */
@Service
@Slf4j
public class LlmClientImpl implements LlmClient {

    private final WebClient webClient;

    @Value("${llm.api.key}")
    private String llmApiKey;

    @Value("${llm.api.endpoint}")
    private String llmApiEndpoint;

    @Value("${llm.model}")
    private String llmModel;

    /**
     * @param webClientBuilder The Spring-configured builder. The LLM gets its own client, without the retry
     *                         filter used against the deployment under test.
     */
    public LlmClientImpl(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    /**
     * {@inheritDoc}
     *
     * @throws DocVerifyException if the endpoint fails or answers without content.
     */
    @Override
    public String complete(String systemPrompt, String userPrompt, boolean jsonObject) {
        LlmRequest llmRequest = new LlmRequest(
                llmModel,
                Arrays.asList(
                        new LlmMessage("system", systemPrompt),
                        new LlmMessage("user", userPrompt)
                )
        );
        if (jsonObject) {
            llmRequest.setResponseFormat(new LlmRequest.ResponseFormat("json_object"));
        }

        LlmResponse response;
        try {
            response = webClient.post()
                    .uri(llmApiEndpoint)
                    .header("Authorization", "Bearer " + llmApiKey)
                    .bodyValue(llmRequest)
                    .retrieve()
                    .bodyToMono(LlmResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("LLM API call failed with status {} and body: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new DocVerifyException("LLM API returned " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            throw new DocVerifyException("Could not reach the LLM API at " + llmApiEndpoint + ": " + e.getMessage(), e);
        }

        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null
                || response.getChoices().get(0).getMessage().getContent() == null) {
            throw new DocVerifyException("Received an empty or invalid response from the LLM.");
        }
        String content = response.getChoices().get(0).getMessage().getContent();
        log.debug("LLM response: {}", content);
        return content;
    }
}
