package com.docverify.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A concrete statement the model derived from a prose query description.
 *
 * @param sql A single read-only statement.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SqlQueryPlan(String sql) {
}
