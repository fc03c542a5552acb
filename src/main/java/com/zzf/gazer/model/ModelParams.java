package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Optional generation parameters. A {@code null} field means "not set".
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelParams {

    public static final ModelParams EMPTY = ModelParams.builder().build();

    Boolean stream;
    Double temperature;
    @JsonProperty("max_tokens")
    Integer maxTokens;
    @JsonProperty("top_p")
    Double topP;
    @JsonProperty("frequency_penalty")
    Double frequencyPenalty;
    @JsonProperty("presence_penalty")
    Double presencePenalty;
    @JsonProperty("stop")
    List<String> stopSequences;
    ReasoningParams reasoning;

    /**
     * Right-biased field-wise override: every non-null field of {@code override} replaces the field here.
     */
    public ModelParams merge(ModelParams override) {
        if (override == null) {
            return this;
        }
        return ModelParams.builder()
                .stream(override.stream != null ? override.stream : stream)
                .temperature(override.temperature != null ? override.temperature : temperature)
                .maxTokens(override.maxTokens != null ? override.maxTokens : maxTokens)
                .topP(override.topP != null ? override.topP : topP)
                .frequencyPenalty(override.frequencyPenalty != null ? override.frequencyPenalty : frequencyPenalty)
                .presencePenalty(override.presencePenalty != null ? override.presencePenalty : presencePenalty)
                .stopSequences(override.stopSequences != null ? override.stopSequences : stopSequences)
                .reasoning(override.reasoning != null ? override.reasoning : reasoning)
                .build();
    }

    /**
     * @throws IllegalArgumentException when a set value is out of its accepted range
     */
    public void validate() {
        if (temperature != null && (temperature < 0 || temperature > 2)) {
            throw new IllegalArgumentException(String.format("temperature must be between 0 and 2, got %.2f", temperature));
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("max_tokens must be positive, got " + maxTokens);
        }
        if (topP != null && (topP < 0 || topP > 1)) {
            throw new IllegalArgumentException(String.format("top_p must be between 0 and 1, got %.2f", topP));
        }
        if (frequencyPenalty != null && (frequencyPenalty < -2 || frequencyPenalty > 2)) {
            throw new IllegalArgumentException(String.format("frequency_penalty must be between -2 and 2, got %.2f", frequencyPenalty));
        }
        if (presencePenalty != null && (presencePenalty < -2 || presencePenalty > 2)) {
            throw new IllegalArgumentException(String.format("presence_penalty must be between -2 and 2, got %.2f", presencePenalty));
        }
    }

    /**
     * Builds params from loosely typed values (numbers of any width, string lists).
     * Keys with values of an unexpected type are ignored.
     */
    public static ModelParams fromMap(Map<String, ?> values) {
        ModelParamsBuilder builder = ModelParams.builder();
        if (values == null) {
            return builder.build();
        }
        values.forEach((key, value) -> {
            switch (key) {
                case "stream" -> {
                    if (value instanceof Boolean b) builder.stream(b);
                }
                case "temperature" -> {
                    if (value instanceof Number n) builder.temperature(n.doubleValue());
                }
                case "max_tokens" -> {
                    if (value instanceof Number n) builder.maxTokens(n.intValue());
                }
                case "top_p" -> {
                    if (value instanceof Number n) builder.topP(n.doubleValue());
                }
                case "frequency_penalty" -> {
                    if (value instanceof Number n) builder.frequencyPenalty(n.doubleValue());
                }
                case "presence_penalty" -> {
                    if (value instanceof Number n) builder.presencePenalty(n.doubleValue());
                }
                case "stop", "stop_sequences" -> {
                    if (value instanceof List<?> list) builder.stopSequences(stringList(list));
                }
                case "reasoning" -> {
                    if (value instanceof Map<?, ?> map) builder.reasoning(reasoningFromMap(map));
                }
                default -> {
                }
            }
        });
        return builder.build();
    }

    private static ReasoningParams reasoningFromMap(Map<?, ?> map) {
        ReasoningParams.ReasoningParamsBuilder builder = ReasoningParams.builder();
        if (map.get("enabled") instanceof Boolean b) builder.enabled(b);
        if (map.get("exclude") instanceof Boolean b) builder.exclude(b);
        if (map.get("max_tokens") instanceof Number n) builder.maxTokens(n.intValue());
        if (map.get("effort") instanceof String s) builder.effort(s);
        return builder.build();
    }

    private static List<String> stringList(List<?> list) {
        List<String> out = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }
}
