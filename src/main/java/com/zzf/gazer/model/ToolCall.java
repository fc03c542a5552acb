package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A function invocation requested by the model. While streaming, {@code index} names the slot the fragment belongs to.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCall {
    private Integer index;
    private String id;
    private String type;
    private FunctionCall function;

    public String functionName() {
        return function == null ? null : function.getName();
    }

    public String arguments() {
        return function == null ? null : function.getArguments();
    }
}
