package com.zzf.gazer.tool;

import com.zzf.gazer.model.Tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of tool declarations, keyed by function name in insertion order.
 */
public final class ToolRegistry {

    private final Map<String, Tool> tools;

    private ToolRegistry(Map<String, Tool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The built-in declarations; image generation only with an image-router key.
     */
    public static ToolRegistry defaults(boolean imageGeneration) {
        return builder()
                .add(ToolDeclarations.weather())
                .add(ToolDeclarations.search())
                .add(ToolDeclarations.fetchUrl())
                .addIf(imageGeneration, ToolDeclarations.generateImage())
                .add(ToolDeclarations.searchImages())
                .build();
    }

    public Map<String, Tool> all() {
        return tools;
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    /**
     * A non-empty allow-list selects exactly those tools; otherwise the exclude-list is removed; both empty means all.
     */
    public Map<String, Tool> available(Collection<String> allowed, Collection<String> excluded) {
        Map<String, Tool> result = new LinkedHashMap<>();
        if (allowed != null && !allowed.isEmpty()) {
            for (String name : allowed) {
                Tool tool = tools.get(name);
                if (tool != null) {
                    result.put(name, tool);
                }
            }
        } else if (excluded != null && !excluded.isEmpty()) {
            tools.forEach((name, tool) -> {
                if (!excluded.contains(name)) {
                    result.put(name, tool);
                }
            });
        } else {
            result.putAll(tools);
        }
        return result;
    }

    public List<Tool> list(Collection<String> allowed, Collection<String> excluded) {
        return new ArrayList<>(available(allowed, excluded).values());
    }

    public List<String> names(Collection<String> allowed, Collection<String> excluded) {
        return new ArrayList<>(available(allowed, excluded).keySet());
    }

    /**
     * Human-readable listing of the available tools and their parameters.
     */
    public String describe(Collection<String> allowed, Collection<String> excluded) {
        StringBuilder sb = new StringBuilder();
        available(allowed, excluded).forEach((name, tool) -> {
            Tool.Function function = tool.getFunction();
            sb.append("• ").append(name).append(": ").append(function.getDescription()).append('\n');
            Tool.Parameters parameters = function.getParameters();
            if (parameters != null && parameters.getProperties() != null && !parameters.getProperties().isEmpty()) {
                sb.append("  Parameters:\n");
                parameters.getProperties().forEach((param, property) -> sb.append("  - ")
                        .append(param).append(" (").append(property.getType()).append("): ")
                        .append(property.getDescription() == null ? "" : property.getDescription())
                        .append('\n'));
            }
        });
        return sb.toString();
    }

    public static final class Builder {
        private final Map<String, Tool> tools = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(Tool tool) {
            tools.put(tool.getFunction().getName(), tool);
            return this;
        }

        public Builder addIf(boolean condition, Tool tool) {
            return condition ? add(tool) : this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(tools);
        }
    }
}
