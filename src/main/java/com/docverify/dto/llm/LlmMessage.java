package com.docverify.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single message in a conversation with the language model.
 */
@Data
@AllArgsConstructor
public class LlmMessage {

    /**
     * "system" for instructions, "user" for the material to work on.
     */
    private String role;

    private String content;
}
