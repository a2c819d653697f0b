package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.SeededFixtures;
import com.docverify.service.api.FixtureSeeder;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Seeds the baseline every assertion can rely on (admin account, organization, site, enrollment key) using
 * the product's public REST API. Existing records are reused, so seeding twice is harmless.
 */
@Service
@Slf4j
public class ApiFixtureSeeder implements FixtureSeeder {

    private static final String REGISTER = "/api/v1/auth/register";
    private static final String LOGIN = "/api/v1/auth/login";
    private static final String ORGANIZATIONS = "/api/v1/orgs/organizations";
    private static final String SITES = "/api/v1/orgs/sites";
    private static final String ENROLLMENT_KEYS = "/api/v1/enrollment-keys";

    private final WebClient webClient;

    @Value("${docverify.admin.email}")
    private String adminEmail;

    @Value("${docverify.admin.password}")
    private String adminPassword;

    @Value("${docverify.seed.organization-name:Doc Verify}")
    private String organizationName;

    @Value("${docverify.seed.site-name:Doc Verify Site}")
    private String siteName;

    public ApiFixtureSeeder(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public SeededFixtures seed(String apiBaseUrl) {
        log.info("Seeding fixtures against {}", apiBaseUrl);
        register(apiBaseUrl);
        String token = authenticate(apiBaseUrl, adminEmail, adminPassword);

        String orgId = firstId(apiBaseUrl, ORGANIZATIONS, token)
                .orElseGet(() -> createOrganization(apiBaseUrl, token));
        String siteId = firstId(apiBaseUrl, SITES + "?orgId=" + orgId, token)
                .orElseGet(() -> createSite(apiBaseUrl, token, orgId));
        // Only hashes of enrollment keys can be listed, so a usable key is always a fresh one.
        String enrollmentKey = createEnrollmentKey(apiBaseUrl, token, orgId, siteId);

        log.info("Fixtures ready: org={}, site={}", orgId, siteId);
        return new SeededFixtures(orgId, siteId, enrollmentKey, adminEmail, adminPassword);
    }

    @Override
    public String authenticate(String apiBaseUrl, String email, String password) {
        HttpResult response = call(HttpMethod.POST, apiBaseUrl, LOGIN, null,
                Map.of("email", email, "password", password));
        if (!response.isSuccess()) {
            throw new DocVerifyException("Login as " + email + " failed with status " + response.status()
                    + ": " + TargetUrls.truncate(response.body(), 200));
        }
        return read(response.body(), "$.tokens.accessToken")
                .orElseThrow(() -> new DocVerifyException("Login response carries no access token"));
    }

    private void register(String apiBaseUrl) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", adminEmail);
        body.put("password", adminPassword);
        body.put("name", "Doc Verify Admin");
        HttpResult response = call(HttpMethod.POST, apiBaseUrl, REGISTER, null, body);
        if (response.isSuccess()) {
            log.info("Registered admin {}", adminEmail);
        } else if (response.status() == 400 || response.status() == 409) {
            log.debug("Admin {} already exists", adminEmail);
        } else {
            throw new DocVerifyException("Registering " + adminEmail + " failed with status " + response.status()
                    + ": " + TargetUrls.truncate(response.body(), 200));
        }
    }

    private String createOrganization(String apiBaseUrl, String token) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", organizationName);
        body.put("slug", "doc-verify");
        return createAndReadId(apiBaseUrl, ORGANIZATIONS, token, body, "organization");
    }

    private String createSite(String apiBaseUrl, String token, String orgId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orgId", orgId);
        body.put("name", siteName);
        body.put("timezone", "UTC");
        return createAndReadId(apiBaseUrl, SITES, token, body, "site");
    }

    private String createEnrollmentKey(String apiBaseUrl, String token, String orgId, String siteId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orgId", orgId);
        body.put("siteId", siteId);
        body.put("name", "doc-verify");
        HttpResult response = expectSuccess(call(HttpMethod.POST, apiBaseUrl, ENROLLMENT_KEYS, token, body),
                "enrollment key");
        return read(response.body(), "$.key")
                .orElseThrow(() -> new DocVerifyException("Enrollment key response carries no key"));
    }

    private String createAndReadId(String apiBaseUrl, String path, String token, Map<String, Object> body,
                                   String what) {
        HttpResult response = expectSuccess(call(HttpMethod.POST, apiBaseUrl, path, token, body), what);
        log.info("Created {} {}", what, body.get("name"));
        return read(response.body(), "$.id")
                .or(() -> read(response.body(), "$.data.id"))
                .orElseThrow(() -> new DocVerifyException("Created " + what + " but the response carries no id"));
    }

    private Optional<String> firstId(String apiBaseUrl, String path, String token) {
        HttpResult response = call(HttpMethod.GET, apiBaseUrl, path, token, null);
        if (!response.isSuccess()) {
            log.debug("Listing {} returned {}", path, response.status());
            return Optional.empty();
        }
        return read(response.body(), "$.data[0].id").or(() -> read(response.body(), "$[0].id"));
    }

    private static HttpResult expectSuccess(HttpResult response, String what) {
        if (!response.isSuccess()) {
            throw new DocVerifyException("Creating " + what + " failed with status " + response.status()
                    + ": " + TargetUrls.truncate(response.body(), 200));
        }
        return response;
    }

    private HttpResult call(HttpMethod method, String apiBaseUrl, String path, String token, Object body) {
        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(URI.create(TargetUrls.join(apiBaseUrl, path)))
                .headers(headers -> {
                    if (token != null) {
                        headers.setBearerAuth(token);
                    }
                });
        WebClient.RequestHeadersSpec<?> ready = body == null
                ? request
                : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        return ready.exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new HttpResult(response.statusCode().value(), text)))
                .block();
    }

    private static Optional<String> read(String json, String path) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            Object value = JsonPath.read(json, path);
            return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
        } catch (PathNotFoundException e) {
            return Optional.empty();
        } catch (RuntimeException e) {
            log.debug("Could not read {} from response: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private record HttpResult(int status, String body) {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
