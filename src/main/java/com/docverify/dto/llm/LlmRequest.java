package com.docverify.dto.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * Chat-completions request payload.
 * <p>
 * {@code response_format} is optional: claim extraction asks for a bare JSON array, which the
 * {@code json_object} mode does not allow, so it is only set when the caller wants an object back.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LlmRequest {

    private String model;

    private List<LlmMessage> messages;

    private Double temperature = 0.0;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat;

    public LlmRequest(String model, List<LlmMessage> messages) {
        this.model = model;
        this.messages = messages;
    }

    /**
     * Desired response format, e.g. {@code json_object}.
     */
    @Data
    public static class ResponseFormat {

        private String type;

        public ResponseFormat(String type) {
            this.type = type;
        }
    }
}
