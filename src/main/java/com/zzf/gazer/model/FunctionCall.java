package com.zzf.gazer.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.zzf.gazer.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FunctionCall {
    private String name;
    private String arguments;

    /**
     * Decodes the assembled arguments string as a JSON object.
     */
    public Map<String, Object> argumentsAsMap() throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        return JsonUtils.MAPPER.readValue(arguments, new TypeReference<Map<String, Object>>() {});
    }
}
