package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Callable-tool declaration handed to the model. Passed through to the wire unchanged.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Tool {
    @Builder.Default
    String type = "function";
    Function function;

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Function {
        String name;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        String description;
        Parameters parameters;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Parameters {
        @Builder.Default
        String type = "object";
        @Singular("property")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        Map<String, Property> properties;
        List<String> required;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Property {
        String type;
        @JsonProperty("enum")
        List<String> enumValues;
        String description;
        Property items;
    }

    public static Tool function(String name, String description, Parameters parameters) {
        return Tool.builder()
                .function(Function.builder().name(name).description(description).parameters(parameters).build())
                .build();
    }
}
