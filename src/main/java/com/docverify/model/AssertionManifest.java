package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The durable root of all extracted assertions, grouped by page in documentation order.
 * Written in full at the end of an extraction run and only read while assertions run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssertionManifest {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;

    private Instant generatedAt;

    private List<PageAssertions> pages = new ArrayList<>();

    /**
     * @return A manifest with no pages, stamped now.
     */
    public static AssertionManifest empty() {
        return new AssertionManifest(CURRENT_VERSION, Instant.now(), new ArrayList<>());
    }
}
