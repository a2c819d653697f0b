package com.docverify.model;

/**
 * Baseline data prepared in the live system before assertions run.
 *
 * @param orgId         The organization assertions run against.
 * @param siteId        A site inside that organization.
 * @param enrollmentKey A raw agent enrollment key for the organization.
 * @param adminEmail    The admin account used for login.
 * @param adminPassword Its password.
 */
public record SeededFixtures(String orgId,
                             String siteId,
                             String enrollmentKey,
                             String adminEmail,
                             String adminPassword) {
}
