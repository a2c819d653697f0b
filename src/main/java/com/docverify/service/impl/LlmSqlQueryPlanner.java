package com.docverify.service.impl;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.dto.llm.SqlQueryPlan;
import com.docverify.exception.DocVerifyException;
import com.docverify.model.EnvironmentContext;
import com.docverify.model.SqlTest;
import com.docverify.service.api.LlmClient;
import com.docverify.service.api.SqlQueryPlanner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LlmSqlQueryPlanner implements SqlQueryPlanner {

    static final String PLAN_PROMPT = """
            You write PostgreSQL queries that check claims made in product documentation.
            Given a plain-language description of what to look up, the database schema and the identifiers of the \
            seeded test fixtures, write ONE read-only SELECT (or WITH ... SELECT) statement that answers it.
            Never modify data. Use only tables and columns from the schema. Inline fixture identifiers as literals.
            Respond with ONLY a JSON object: {"sql": "SELECT ..."}
            """;

    static final String JUDGE_PROMPT = """
            You decide whether a database query result satisfies a claim made in product documentation.
            Be strict: the claim holds only if the rows clearly show the expected result.
            Respond with ONLY a JSON object: {"pass": true|false, "reason": "one sentence"}
            """;

    // Credentials never leave the process.
    private static final Set<String> SHAREABLE_KEYS = Set.of(
            EnvironmentContext.ORG_ID, EnvironmentContext.SITE_ID, EnvironmentContext.ADMIN_EMAIL);

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public LlmSqlQueryPlanner(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String plan(SqlTest test, EnvironmentContext environment, String schema) {
        String fixtures = environment.asMap().entrySet().stream()
                .filter(entry -> SHAREABLE_KEYS.contains(entry.getKey()))
                .map(entry -> entry.getKey() + " = " + entry.getValue())
                .collect(Collectors.joining("\n"));
        String userPrompt = "Look up: " + environment.resolve(test.query())
                + "\n\n## Seeded fixtures\n" + fixtures
                + "\n\n## Schema\n" + schema;

        SqlQueryPlan plan = readJson(llmClient.complete(PLAN_PROMPT, userPrompt, true), SqlQueryPlan.class);
        if (plan.sql() == null || plan.sql().isBlank()) {
            throw new DocVerifyException("LLM returned no SQL for: " + test.query());
        }
        return plan.sql();
    }

    @Override
    public LlmVerdict judge(SqlTest test, String sql, String rowsJson) {
        String userPrompt = "Expected: " + test.expect()
                + "\n\nQuery: " + sql
                + "\n\nRows (JSON): " + rowsJson;
        return readJson(llmClient.complete(JUDGE_PROMPT, userPrompt, true), LlmVerdict.class);
    }

    private <T> T readJson(String content, Class<T> type) {
        try {
            return objectMapper.readValue(AssertionResponseParser.stripCodeFence(content), type);
        } catch (JsonProcessingException e) {
            throw new DocVerifyException("LLM answer is not a valid " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
