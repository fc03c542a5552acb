package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Non-streaming chat-completions response body.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompletionResponse {
    private String id;
    private String model;
    private List<Choice> choices;
    private Usage usage;
    private List<Annotation> annotations;
    private ProviderError error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private ResponseMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseMessage {
        private String content;
        private String reasoning;
        @JsonProperty("reasoning_content")
        private String reasoningContent;
        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;
        private List<Annotation> annotations;

        /**
         * {@code reasoning}, falling back to {@code reasoning_content} when empty.
         */
        public String effectiveReasoning() {
            if (reasoning != null && !reasoning.isEmpty()) {
                return reasoning;
            }
            return reasoningContent == null ? "" : reasoningContent;
        }
    }
}
