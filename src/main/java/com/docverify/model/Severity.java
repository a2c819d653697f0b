package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How important a documented claim is. Reported alongside results, never used to decide the exit code.
 */
public enum Severity {
    @JsonProperty("critical")
    CRITICAL,
    @JsonProperty("warning")
    WARNING,
    @JsonProperty("info")
    INFO
}
