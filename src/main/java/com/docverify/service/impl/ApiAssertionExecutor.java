package com.docverify.service.impl;

import com.docverify.model.ApiTest;
import com.docverify.model.Assertion;
import com.docverify.model.AssertionResult;
import com.docverify.model.EnvironmentContext;
import com.docverify.service.api.AssertionExecutor;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Issues the HTTP call an api assertion describes and compares the response with its expectations.
 * Every mismatch is collected, so one failing result lists all the ways the response differed.
 */
@Service
@Slf4j
public class ApiAssertionExecutor implements AssertionExecutor {

    private static final int BODY_SNIPPET_LENGTH = 300;

    private final WebClient webClient;

    public ApiAssertionExecutor(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public AssertionResult execute(Assertion assertion, String apiBaseUrl, EnvironmentContext environment) {
        if (!(assertion.getTest() instanceof ApiTest test)) {
            throw new IllegalArgumentException("Assertion " + assertion.getId() + " is not an api assertion");
        }

        String method = test.method().toUpperCase(Locale.ROOT);
        String url = TargetUrls.join(apiBaseUrl, environment.resolve(test.path()));
        log.debug("{} {}", method, url);

        ApiResponse response = send(test, method, url, environment);

        List<String> mismatches = compare(test.expect(), response, environment);
        if (mismatches.isEmpty()) {
            return AssertionResult.pass(assertion);
        }
        String reason = String.join("; ", mismatches)
                + " [" + method + " " + url + " -> " + response.status() + ": "
                + TargetUrls.truncate(response.body(), BODY_SNIPPET_LENGTH) + "]";
        return AssertionResult.fail(assertion, reason);
    }

    private ApiResponse send(ApiTest test, String method, String url, EnvironmentContext environment) {
        // URI.create keeps WebClient from treating {braces} left in the path as template variables.
        WebClient.RequestBodySpec request = webClient.method(HttpMethod.valueOf(method))
                .uri(URI.create(url))
                .headers(headers -> {
                    environment.get(EnvironmentContext.AUTH_TOKEN).ifPresent(headers::setBearerAuth);
                    if (test.headers() != null) {
                        test.headers().forEach((name, value) -> headers.set(name, environment.resolve(value)));
                    }
                });

        WebClient.RequestHeadersSpec<?> ready = request;
        if (test.body() != null && !test.body().isNull()) {
            ready = request.contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(environment.resolve(test.body().toString()));
        }

        return ready.exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ApiResponse(
                                clientResponse.statusCode().value(),
                                clientResponse.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE),
                                body)))
                .block();
    }

    private List<String> compare(ApiTest.Expectation expect, ApiResponse response, EnvironmentContext environment) {
        List<String> mismatches = new ArrayList<>();
        if (expect == null) {
            return mismatches;
        }

        if (expect.status() != null && expect.status() != response.status()) {
            mismatches.add("expected status " + expect.status() + ", got " + response.status());
        }

        if (expect.bodyContains() != null) {
            for (String expected : expect.bodyContains()) {
                String resolved = environment.resolve(expected);
                if (!response.body().contains(resolved)) {
                    mismatches.add("body does not contain \"" + resolved + "\"");
                }
            }
        }

        if (expect.bodyNotContains() != null) {
            for (String forbidden : expect.bodyNotContains()) {
                String resolved = environment.resolve(forbidden);
                if (response.body().contains(resolved)) {
                    mismatches.add("body contains forbidden \"" + resolved + "\"");
                }
            }
        }

        if (expect.contentType() != null && !expect.contentType().isBlank()) {
            String actual = response.contentType() == null ? "" : response.contentType();
            if (!actual.toLowerCase(Locale.ROOT).startsWith(expect.contentType().toLowerCase(Locale.ROOT))) {
                mismatches.add("expected content-type " + expect.contentType() + ", got "
                        + (actual.isEmpty() ? "none" : actual));
            }
        }

        if (expect.jsonPath() != null) {
            for (Map.Entry<String, Object> entry : expect.jsonPath().entrySet()) {
                checkJsonPath(entry.getKey(), entry.getValue(), response.body(), environment, mismatches);
            }
        }
        return mismatches;
    }

    private void checkJsonPath(String expression, Object expected, String body, EnvironmentContext environment,
                               List<String> mismatches) {
        Object resolvedExpected = expected instanceof String text ? environment.resolve(text) : expected;
        try {
            Object actual = JsonPath.read(body, expression);
            if (!valuesMatch(resolvedExpected, actual)) {
                mismatches.add("jsonPath " + expression + ": expected " + resolvedExpected + ", got " + actual);
            }
        } catch (PathNotFoundException e) {
            mismatches.add("jsonPath " + expression + " not found");
        } catch (InvalidJsonException | IllegalArgumentException e) {
            mismatches.add("jsonPath " + expression + " could not be evaluated: body is not JSON");
        }
    }

    private static boolean valuesMatch(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        if (expected instanceof Number && actual instanceof Number) {
            return new BigDecimal(expected.toString()).compareTo(new BigDecimal(actual.toString())) == 0;
        }
        return String.valueOf(expected).equals(String.valueOf(actual));
    }

    private record ApiResponse(int status, String contentType, String body) {
    }
}
