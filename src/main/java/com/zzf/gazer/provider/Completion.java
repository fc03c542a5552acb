package com.zzf.gazer.provider;

import com.zzf.gazer.model.CompletionResponse;
import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a blocking completion. {@code params} is set when the call went through the registry.
 */
@Value
@Builder(toBuilder = true)
public class Completion {
    String content;
    String reasoning;
    CompletionResponse response;
    ModelInfo model;
    ModelParams params;
}
