package com.docverify.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seeded identifiers and credentials shared by every assertion of a run.
 * Built once, never modified afterwards: every executor sees the same values.
 */
public final class EnvironmentContext {

    public static final String ORG_ID = "orgId";
    public static final String SITE_ID = "siteId";
    public static final String ENROLLMENT_KEY = "enrollmentKey";
    public static final String ENROLLMENT_SECRET = "enrollmentSecret";
    public static final String ADMIN_EMAIL = "adminEmail";
    public static final String ADMIN_PASSWORD = "adminPassword";
    public static final String AUTH_TOKEN = "authToken";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9_]*)}");

    private final Map<String, String> values;

    private EnvironmentContext(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static EnvironmentContext of(Map<String, String> values) {
        Map<String, String> nonNull = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                nonNull.put(key, value);
            }
        });
        return new EnvironmentContext(nonNull);
    }

    public static EnvironmentContext empty() {
        return new EnvironmentContext(Map.of());
    }

    /**
     * Builds the context for a run from the seeded fixtures and the token obtained for the admin.
     */
    public static EnvironmentContext from(SeededFixtures fixtures, String authToken, String enrollmentSecret) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ORG_ID, fixtures.orgId());
        values.put(SITE_ID, fixtures.siteId());
        values.put(ENROLLMENT_KEY, fixtures.enrollmentKey());
        values.put(ADMIN_EMAIL, fixtures.adminEmail());
        values.put(ADMIN_PASSWORD, fixtures.adminPassword());
        values.put(AUTH_TOKEN, authToken);
        values.put(ENROLLMENT_SECRET, enrollmentSecret);
        return of(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * @return An unmodifiable view of every value.
     */
    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Replaces {@code {key}} placeholders with context values. Unknown placeholders are left as they are.
     */
    public String resolve(String template) {
        if (template == null || template.indexOf('{') < 0) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    @Override
    public String toString() {
        // Credentials stay out of logs.
        return "EnvironmentContext" + values.keySet();
    }
}
