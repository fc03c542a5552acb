package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload of one {@code data:} line of a streamed completion.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamEvent {

    public static final String FINISH_TOOL_CALLS = "tool_calls";
    public static final String FINISH_ERROR = "error";

    private String id;
    private List<Choice> choices;
    private Usage usage;
    private ProviderError error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private Delta delta;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Delta {
        private String content;
        private String reasoning;
        @JsonProperty("reasoning_content")
        private String reasoningContent;
        private List<Annotation> annotations;
        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;
    }
}
