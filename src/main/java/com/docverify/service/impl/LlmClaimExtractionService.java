package com.docverify.service.impl;

import com.docverify.service.api.ClaimExtractionService;
import com.docverify.service.api.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Asks the language model to read one documentation page and list every testable claim on it as assertions.
 */
@Service
@Slf4j
public class LlmClaimExtractionService implements ClaimExtractionService {

    static final String SYSTEM_PROMPT = """
            You extract testable assertions from product documentation. Each assertion is a claim the \
            documentation makes about observable behavior of the running product, turned into a check that can \
            be executed against a live deployment.

            Respond with ONLY a JSON array. No markdown fences, no commentary. Each element has this shape:
            {
              "id": "unique id within this page, e.g. <page-slug>-01",
              "claim": "the documented behavior in one sentence",
              "severity": "critical | warning | info",
              "type": "api | sql | ui",
              "test": { ...one of the shapes below, matching "type"... }
            }

            ## type = "api"
            {
              "method": "GET | POST | PUT | PATCH | DELETE",
              "path": "/api/v1/...  (use {orgId}, {siteId}, {enrollmentKey} placeholders for seeded fixtures)",
              "body": { optional JSON request body },
              "headers": { optional extra headers },
              "expect": {
                "status": 200,
                "bodyContains": ["substrings that must appear"],
                "bodyNotContains": ["substrings that must not appear"],
                "contentType": "application/json",
                "jsonPath": { "$.data[0].id": "expected value" }
              }
            }
            The request is sent with the seeded admin's bearer token.

            ## type = "sql"
            {
              "query": "what to look up in the database, in plain words",
              "expect": "what the documentation says the result should be"
            }

            ## type = "ui"
            {
              "navigate": "/path/in/the/web/app",
              "setup": ["optional steps a user takes first"],
              "verify": "what should be visible on the page, in plain words"
            }

            ## Rules
            1. Only extract claims that can be checked against a freshly seeded deployment with one organization, \
            one site, one enrollment key and one admin user.
            2. Skip claims that depend on external services (email delivery, SSO providers, third-party \
            integrations, payment processors) or on a particular operating system, agent install or device.
            3. Severity: "critical" for security, data integrity and core workflows; "warning" for behavior users \
            rely on; "info" for cosmetic or descriptive claims.
            4. Ids must be unique within the page and derived from the claim, so the same claim gets the same id \
            when the page is processed again.
            5. If the page makes no testable claims, respond with [].
            """;

    private final LlmClient llmClient;

    public LlmClaimExtractionService(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public String extractClaims(String source, String pageText) {
        log.debug("Requesting assertions for {} ({} chars)", source, pageText.length());
        String userPrompt = "Documentation page: " + source + "\n\n" + pageText;
        return llmClient.complete(SYSTEM_PROMPT, userPrompt, false);
    }
}
