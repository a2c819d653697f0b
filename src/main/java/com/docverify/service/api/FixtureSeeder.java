package com.docverify.service.api;

import com.docverify.model.SeededFixtures;

/**
 * Prepares baseline data through the product's own public API.
 */
public interface FixtureSeeder {

    /**
     * Registers or reuses the admin account, an organization, a site and an enrollment key. Safe to call when
     * the fixtures already exist.
     *
     * @param apiBaseUrl The product API base URL.
     * @return The identifiers assertions can refer to.
     */
    SeededFixtures seed(String apiBaseUrl);

    /**
     * @return A bearer token for the given account.
     */
    String authenticate(String apiBaseUrl, String email, String password);
}
