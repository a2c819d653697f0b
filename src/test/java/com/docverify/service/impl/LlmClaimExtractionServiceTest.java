package com.docverify.service.impl;

import com.docverify.service.api.LlmClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmClaimExtractionServiceTest {

    @Mock
    private LlmClient llmClient;

    @InjectMocks
    private LlmClaimExtractionService extractionService;

    @Test
    void extractClaims_shouldSendPageWithSourceAndAskForFreeFormArray() {
        when(llmClient.complete(LlmClaimExtractionService.SYSTEM_PROMPT,
                "Documentation page: agents/intro.mdx\n\n# Agents", false)).thenReturn("[]");

        assertThat(extractionService.extractClaims("agents/intro.mdx", "# Agents")).isEqualTo("[]");
    }

    @Test
    void systemPrompt_shouldDescribeAllThreeShapes() {
        assertThat(LlmClaimExtractionService.SYSTEM_PROMPT)
                .contains("\"api\"")
                .contains("\"sql\"")
                .contains("\"ui\"");
    }
}
