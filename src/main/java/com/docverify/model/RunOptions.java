package com.docverify.model;

/**
 * Everything a run needs besides the manifest.
 *
 * @param apiBaseUrl     Product API base URL, e.g. "http://localhost:3001".
 * @param uiBaseUrl      Web UI base URL.
 * @param databaseUrl    Database connection target; blank disables sql assertions.
 * @param environment    The shared, read-only context.
 * @param pageFilter     Substring a page source must contain, or null for all pages.
 * @param kindFilter     Only run this kind, or null for all kinds.
 */
public record RunOptions(String apiBaseUrl,
                         String uiBaseUrl,
                         String databaseUrl,
                         EnvironmentContext environment,
                         String pageFilter,
                         AssertionKind kindFilter) {
}
