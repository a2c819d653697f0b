package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The execution strategy an {@link Assertion} is dispatched to.
 * The lowercase code is what appears in the manifest and on the command line ({@code --type api}).
 */
public enum AssertionKind {
    API("api"),
    SQL("sql"),
    UI("ui");

    private final String code;

    AssertionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a kind from its manifest code, ignoring case.
     *
     * @param code The code, e.g. "api".
     * @return The matching kind.
     * @throws IllegalArgumentException if the code names no kind.
     */
    @JsonCreator
    public static AssertionKind fromCode(String code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code.equalsIgnoreCase(code == null ? "" : code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown assertion type: " + code + " (expected api, sql or ui)"));
    }
}
