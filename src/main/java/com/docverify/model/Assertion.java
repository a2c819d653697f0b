package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One structured, executable claim derived from a documentation page.
 * <p>
 * The JSON form keeps the discriminator next to the payload, the way the extraction service emits it:
 * <pre>
 * { "id": "agents-01", "claim": "...", "severity": "critical", "type": "api", "test": { ... } }
 * </pre>
 * Lombok's {@code @Data} generates accessors, {@code equals}/{@code hashCode} and {@code toString}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "claim", "severity"})
public class Assertion {

    /**
     * Unique within its page. Expected to survive re-extraction of an unchanged claim.
     */
    private String id;

    /**
     * The documented behavior, in prose.
     */
    private String claim;

    private Severity severity;

    /**
     * The kind-specific test definition, selected by the sibling {@code type} property.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXTERNAL_PROPERTY, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = ApiTest.class, name = "api"),
            @JsonSubTypes.Type(value = SqlTest.class, name = "sql"),
            @JsonSubTypes.Type(value = UiTest.class, name = "ui")
    })
    private AssertionTest test;

    /**
     * @return The execution strategy for this assertion, derived from its test definition.
     */
    @JsonIgnore
    public AssertionKind getKind() {
        return test == null ? null : test.kind();
    }
}
