package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of executing a single assertion.
 * <ul>
 *   <li>{@link #PASS}: the documented expectation holds.</li>
 *   <li>{@link #FAIL}: the executor ran and found the product does not match the claim.</li>
 *   <li>{@link #SKIP}: a precondition could not be satisfied (no database target, no browser, login redirect).</li>
 *   <li>{@link #ERROR}: the executor itself blew up. Points at the harness, not at the product.</li>
 * </ul>
 */
public enum AssertionStatus {
    @JsonProperty("pass")
    PASS,
    @JsonProperty("fail")
    FAIL,
    @JsonProperty("skip")
    SKIP,
    @JsonProperty("error")
    ERROR;

    public String label() {
        return name().toLowerCase();
    }
}
