package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmClientImplTest {

    private MockWebServer mockLlmServer;
    private LlmClientImpl llmClient;

    @BeforeEach
    void setUp() throws IOException {
        mockLlmServer = new MockWebServer();
        mockLlmServer.start();
        llmClient = new LlmClientImpl(WebClient.builder());
        String baseUrl = String.format("http://localhost:%s", mockLlmServer.getPort());
        ReflectionTestUtils.setField(llmClient, "llmApiEndpoint", baseUrl);
        ReflectionTestUtils.setField(llmClient, "llmApiKey", "test-key");
        ReflectionTestUtils.setField(llmClient, "llmModel", "test-model");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockLlmServer.shutdown();
    }

    @Test
    void complete_shouldSendBothMessagesAndReturnContent() throws Exception {
        // --- Arrange ---
        String llmResponseJson = "{ \"choices\": [ { \"message\": { \"role\": \"assistant\", \"content\": \"{\\\"pass\\\":true,\\\"reason\\\":\\\"ok\\\"}\" } } ] }";
        mockLlmServer.enqueue(new MockResponse()
                .setBody(llmResponseJson)
                .addHeader("Content-Type", "application/json"));

        // --- Act ---
        String content = llmClient.complete("You judge things.", "Is it ok?", true);

        // --- Assert ---
        assertThat(content).isEqualTo("{\"pass\":true,\"reason\":\"ok\"}");
        RecordedRequest recordedRequest = mockLlmServer.takeRequest();
        String requestBody = recordedRequest.getBody().readUtf8();
        assertThat(recordedRequest.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(requestBody).contains("\"model\":\"test-model\"");
        assertThat(requestBody).contains("\"role\":\"system\",\"content\":\"You judge things.\"");
        assertThat(requestBody).contains("\"role\":\"user\",\"content\":\"Is it ok?\"");
        assertThat(requestBody).contains("\"response_format\":{\"type\":\"json_object\"}");
    }

    @Test
    void complete_shouldOmitResponseFormatForFreeFormAnswers() throws Exception {
        mockLlmServer.enqueue(new MockResponse()
                .setBody("{ \"choices\": [ { \"message\": { \"role\": \"assistant\", \"content\": \"[]\" } } ] }")
                .addHeader("Content-Type", "application/json"));

        assertThat(llmClient.complete("system", "user", false)).isEqualTo("[]");
        assertThat(mockLlmServer.takeRequest().getBody().readUtf8()).doesNotContain("response_format");
    }

    @Test
    void complete_shouldWrapHttpErrors() {
        mockLlmServer.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));

        assertThatThrownBy(() -> llmClient.complete("system", "user", false))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("401");
        assertThat(mockLlmServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void complete_shouldRejectEmptyChoices() {
        mockLlmServer.enqueue(new MockResponse()
                .setBody("{ \"choices\": [] }")
                .addHeader("Content-Type", "application/json"));

        assertThatThrownBy(() -> llmClient.complete("system", "user", false))
                .isInstanceOf(DocVerifyException.class)
                .hasMessageContaining("empty or invalid");
    }
}
