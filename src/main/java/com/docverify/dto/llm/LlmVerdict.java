package com.docverify.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The model's judgement of whether observed evidence satisfies a documented claim.
 *
 * @param pass   Whether the claim holds.
 * @param reason Short explanation, mostly useful when {@code pass} is false.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmVerdict(boolean pass, String reason) {
}
