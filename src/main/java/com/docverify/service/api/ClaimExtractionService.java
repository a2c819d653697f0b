package com.docverify.service.api;

/**
 * The external text-to-structured-data service that reads a documentation page and proposes assertions.
 * Treated as unreliable: callers must validate whatever comes back.
 */
public interface ClaimExtractionService {

    /**
     * @param source   The page source, for context.
     * @param pageText The full page text.
     * @return The raw response, expected to be a JSON array of assertions.
     */
    String extractClaims(String source, String pageText);
}
