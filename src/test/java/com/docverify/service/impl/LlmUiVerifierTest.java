package com.docverify.service.impl;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.model.UiTest;
import com.docverify.service.api.LlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmUiVerifierTest {

    @Mock
    private LlmClient llmClient;

    @Test
    void verify_shouldDescribePageAndSetupStepsAndTruncateLongText() {
        LlmUiVerifier verifier = new LlmUiVerifier(llmClient, new ObjectMapper());
        ReflectionTestUtils.setField(verifier, "maxPageText", 20);
        when(llmClient.complete(eq(LlmUiVerifier.SYSTEM_PROMPT), anyString(), eq(true)))
                .thenReturn("{\"pass\": true, \"reason\": \"button visible\"}");
        UiTest test = new UiTest("/settings", List.of("open the Profile tab"), "A Save button is visible");

        LlmVerdict verdict = verifier.verify(test, "http://ui.test/settings", "Settings",
                "Profile Security Notifications Save Cancel");

        assertThat(verdict.pass()).isTrue();
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).complete(eq(LlmUiVerifier.SYSTEM_PROMPT), prompt.capture(), eq(true));
        assertThat(prompt.getValue())
                .contains("Should be visible: A Save button is visible")
                .contains("- open the Profile tab")
                .contains("URL: http://ui.test/settings")
                .contains("Title: Settings")
                .contains("Profile Security ...")
                .doesNotContain("Cancel");
    }
}
