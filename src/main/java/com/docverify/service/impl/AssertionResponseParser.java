package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.ApiTest;
import com.docverify.model.Assertion;
import com.docverify.model.AssertionTest;
import com.docverify.model.Severity;
import com.docverify.model.SqlTest;
import com.docverify.model.UiTest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns the extraction service's raw answer into validated assertions.
 * <p>
 * The answer is accepted as a bare JSON array, optionally wrapped in a markdown code fence, or as an object
 * with an {@code assertions} array. Anything else, any assertion missing its id, claim or test fields, or two
 * assertions sharing an id, rejects the whole answer.
 */
@Component
public class AssertionResponseParser {

    private static final TypeReference<List<Assertion>> ASSERTION_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public AssertionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param raw The extraction service's answer.
     * @return The assertions, in the order given. Missing severities default to {@link Severity#INFO}.
     * @throws DocVerifyException if the answer is not a well-formed list of assertions.
     */
    public List<Assertion> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DocVerifyException("Extraction response was empty");
        }
        List<Assertion> assertions;
        try {
            JsonNode root = objectMapper.readTree(stripCodeFence(raw));
            if (root.isObject() && root.has("assertions")) {
                root = root.get("assertions");
            }
            if (!root.isArray()) {
                throw new DocVerifyException("Extraction response is not a JSON array");
            }
            assertions = objectMapper.convertValue(root, ASSERTION_LIST);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DocVerifyException("Extraction response is not valid assertion JSON: " + e.getMessage(), e);
        }

        Set<String> ids = new HashSet<>();
        List<Assertion> validated = new ArrayList<>(assertions.size());
        for (int i = 0; i < assertions.size(); i++) {
            Assertion assertion = assertions.get(i);
            validate(assertion, i);
            if (!ids.add(assertion.getId())) {
                throw new DocVerifyException("Duplicate assertion id '" + assertion.getId() + "'");
            }
            if (assertion.getSeverity() == null) {
                assertion.setSeverity(Severity.INFO);
            }
            validated.add(assertion);
        }
        return validated;
    }

    private void validate(Assertion assertion, int index) {
        if (assertion == null) {
            throw new DocVerifyException("Assertion #" + index + " is null");
        }
        if (isBlank(assertion.getId())) {
            throw new DocVerifyException("Assertion #" + index + " has no id");
        }
        if (isBlank(assertion.getClaim())) {
            throw new DocVerifyException("Assertion '" + assertion.getId() + "' has no claim");
        }
        AssertionTest test = assertion.getTest();
        if (test == null) {
            throw new DocVerifyException("Assertion '" + assertion.getId() + "' has no test");
        }
        boolean complete;
        if (test instanceof ApiTest api) {
            complete = !isBlank(api.method()) && !isBlank(api.path());
        } else if (test instanceof SqlTest sql) {
            complete = !isBlank(sql.query()) && !isBlank(sql.expect());
        } else if (test instanceof UiTest ui) {
            complete = !isBlank(ui.navigate()) && !isBlank(ui.verify());
        } else {
            complete = false;
        }
        if (!complete) {
            throw new DocVerifyException("Assertion '" + assertion.getId() + "' has an incomplete "
                    + test.kind().code() + " test");
        }
    }

    static String stripCodeFence(String raw) {
        String text = raw.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closingFence = text.lastIndexOf("```");
        if (firstNewline < 0 || closingFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closingFence).trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
