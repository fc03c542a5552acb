package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.gazer.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Chat message. On the wire {@code content} is a plain string when no parts are present, otherwise the part list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private static final TypeReference<List<ContentPart>> PARTS = new TypeReference<>() {};

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String role;
    @JsonIgnore
    private String text;
    @JsonIgnore
    private List<ContentPart> parts;
    private String name;
    @JsonProperty("tool_call_id")
    private String toolCallId;
    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    public static Message system(String text) {
        return Message.builder().role(ROLE_SYSTEM).text(text).build();
    }

    public static Message user(String text) {
        return Message.builder().role(ROLE_USER).text(text).build();
    }

    public static Message user(List<ContentPart> parts) {
        return Message.builder().role(ROLE_USER).parts(parts).build();
    }

    public static Message assistant(String text) {
        return Message.builder().role(ROLE_ASSISTANT).text(text).build();
    }

    public static Message toolResult(String toolCallId, String name, String text) {
        return Message.builder().role(ROLE_TOOL).toolCallId(toolCallId).name(name).text(text).build();
    }

    @JsonGetter("content")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Object wireContent() {
        if (parts != null && !parts.isEmpty()) {
            return parts;
        }
        return text;
    }

    @JsonSetter("content")
    public void wireContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return;
        }
        if (content.isTextual()) {
            this.text = content.asText();
        } else if (content.isArray()) {
            this.parts = JsonUtils.MAPPER.convertValue(content, PARTS);
        } else {
            throw new IllegalArgumentException("unexpected content type: " + content.getNodeType());
        }
    }

    public boolean hasFiles() {
        if (parts == null) {
            return false;
        }
        for (ContentPart part : parts) {
            if (ContentPart.TYPE_FILE.equals(part.getType())) {
                return true;
            }
        }
        return false;
    }
}
