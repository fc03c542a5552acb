package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Chat-completions wire request. {@link #modelInfo} and {@link #webSearch} are request-scoped context and never serialized.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionRequest {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    String model;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    List<Message> messages;
    List<Tool> tools;
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    boolean stream;
    Double temperature;
    ReasoningParams reasoning;
    @JsonProperty("max_tokens")
    Integer maxTokens;
    @JsonProperty("top_p")
    Double topP;
    @JsonProperty("frequency_penalty")
    Double frequencyPenalty;
    @JsonProperty("presence_penalty")
    Double presencePenalty;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<String> stop;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<Plugin> plugins;
    Routing provider;
    UsageOptions usage;

    @JsonIgnore
    boolean webSearch;
    @JsonIgnore
    ModelInfo modelInfo;

    /**
     * Aggregator routing preferences.
     */
    @Value
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public static class Routing {
        public static final String SORT_PRICE = "price";
        public static final String SORT_THROUGHPUT = "throughput";
        public static final String SORT_LATENCY = "latency";

        String sort;
        @JsonProperty("require_parameters")
        boolean requireParameters;
    }

    @Value
    public static class UsageOptions {
        boolean include;
    }
}
