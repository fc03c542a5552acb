package com.zzf.gazer.model;

import com.zzf.gazer.error.AiException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One increment of a streamed completion. Carries only what its source event carried.
 */
@Value
@Builder
public class Chunk {
    @Builder.Default
    String content = "";
    @Builder.Default
    String reasoning = "";
    Usage usage;
    @Singular
    List<ToolCall> toolCalls;
    @Singular
    List<Annotation> annotations;
    String finishReason;
    AiException error;

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasError() {
        return error != null;
    }
}
