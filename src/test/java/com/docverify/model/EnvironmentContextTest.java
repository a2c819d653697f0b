package com.docverify.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentContextTest {

    @Test
    void resolve_shouldSubstituteKnownPlaceholdersAndKeepUnknownOnes() {
        EnvironmentContext context = EnvironmentContext.of(Map.of("orgId", "org-1", "siteId", "site-9"));

        String resolved = context.resolve("/api/v1/orgs/{orgId}/sites/{siteId}?tag={unknown}");

        assertThat(resolved).isEqualTo("/api/v1/orgs/org-1/sites/site-9?tag={unknown}");
    }

    @Test
    void resolve_shouldLeaveJsonBracesAlone() {
        EnvironmentContext context = EnvironmentContext.of(Map.of("orgId", "org-1"));

        assertThat(context.resolve("{\"orgId\":\"{orgId}\"}")).isEqualTo("{\"orgId\":\"org-1\"}");
    }

    @Test
    void from_shouldExposeSeededFixturesAndToken() {
        SeededFixtures fixtures = new SeededFixtures("org-1", "site-1", "ek_abc", "admin@example.com", "pw");

        EnvironmentContext context = EnvironmentContext.from(fixtures, "token-123", null);

        assertThat(context.get(EnvironmentContext.ORG_ID)).contains("org-1");
        assertThat(context.get(EnvironmentContext.AUTH_TOKEN)).contains("token-123");
        assertThat(context.get(EnvironmentContext.ENROLLMENT_SECRET)).isEmpty();
    }

    @Test
    void context_shouldBeUnaffectedByLaterChangesToTheSourceMap() {
        Map<String, String> source = new HashMap<>();
        source.put("orgId", "org-1");
        EnvironmentContext context = EnvironmentContext.of(source);

        source.put("orgId", "changed");

        assertThat(context.get("orgId")).contains("org-1");
        assertThatThrownBy(() -> context.asMap().put("siteId", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toString_shouldNotRevealValues() {
        EnvironmentContext context = EnvironmentContext.of(Map.of("adminPassword", "s3cret"));

        assertThat(context.toString()).contains("adminPassword").doesNotContain("s3cret");
    }
}
