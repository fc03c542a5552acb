package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token accounting. In a stream, a snapshot may be partial.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Usage {
    @JsonProperty("prompt_tokens")
    private long promptTokens;
    @JsonProperty("completion_tokens")
    private long completionTokens;
    @JsonProperty("total_tokens")
    private long totalTokens;
    private double cost;
    @JsonProperty("prompt_tokens_details")
    private Details promptTokensDetails;
    @JsonProperty("completion_tokens_details")
    private Details completionTokensDetails;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Details {
        @JsonProperty("reasoning_tokens")
        private int reasoningTokens;
        @JsonProperty("cached_tokens")
        private int cachedTokens;
    }
}
