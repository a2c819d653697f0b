package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The extraction result for one documentation page.
 * {@code contentHash} is a pure function of the page text; when it matches on a later incremental run the
 * {@code assertions} list is carried forward untouched, which is what keeps assertion ids stable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageAssertions {

    /**
     * Page path relative to the documentation root, e.g. "agents/intro.mdx".
     */
    private String source;

    /**
     * Digest of the page text, prefixed with the algorithm: "sha256:9f86d0...".
     */
    private String contentHash;

    private List<Assertion> assertions = new ArrayList<>();
}
