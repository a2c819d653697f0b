package com.docverify.service.impl;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-addressed digests of documentation pages. Hashing bytes instead of trusting modification times
 * means a checkout that resets mtimes does not trigger re-extraction, and a touched but unchanged file
 * does not either.
 */
public final class ContentHash {

    public static final String ALGORITHM_PREFIX = "sha256:";

    private ContentHash() {
    }

    /**
     * @param text Page text; hashed as UTF-8.
     * @return "sha256:" followed by the lowercase hex digest.
     */
    public static String of(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return ALGORITHM_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
