package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reasoning-token controls. When both are set, {@code max_tokens} is sent and {@code effort} is dropped.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReasoningParams {
    Boolean enabled;
    Boolean exclude;
    @JsonProperty("max_tokens")
    Integer maxTokens;
    String effort;

    @JsonProperty("effort")
    public String getEffort() {
        return maxTokens != null ? null : effort;
    }

    @JsonIgnore
    public String getRequestedEffort() {
        return effort;
    }
}
