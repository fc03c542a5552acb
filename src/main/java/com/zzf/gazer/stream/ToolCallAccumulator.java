package com.zzf.gazer.stream;

import com.zzf.gazer.model.FunctionCall;
import com.zzf.gazer.model.ToolCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds tool calls from streamed fragments, keyed by slot index.
 * Fragments of one slot must be fed in emission order; arguments are concatenated, other fields keep the last non-empty value.
 */
public class ToolCallAccumulator {

    private final Map<Integer, ToolCall> slots = new TreeMap<>();

    public void accept(ToolCall fragment) {
        int index = fragment.getIndex() == null ? 0 : fragment.getIndex();
        FunctionCall fn = fragment.getFunction();
        ToolCall current = slots.get(index);
        if (current == null) {
            slots.put(index, ToolCall.builder()
                    .index(index)
                    .id(fragment.getId())
                    .type(fragment.getType())
                    .function(new FunctionCall(
                            fn == null ? null : fn.getName(),
                            fn == null || fn.getArguments() == null ? "" : fn.getArguments()))
                    .build());
            return;
        }
        if (notEmpty(fragment.getId())) {
            current.setId(fragment.getId());
        }
        if (notEmpty(fragment.getType())) {
            current.setType(fragment.getType());
        }
        if (fn != null) {
            if (notEmpty(fn.getName())) {
                current.getFunction().setName(fn.getName());
            }
            if (notEmpty(fn.getArguments())) {
                current.getFunction().setArguments(current.getFunction().getArguments() + fn.getArguments());
            }
        }
    }

    /**
     * Returns the assembled calls in slot order and starts over with an empty slot map.
     */
    public List<ToolCall> drain() {
        List<ToolCall> finished = new ArrayList<>(slots.values());
        slots.clear();
        return finished;
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public int size() {
        return slots.size();
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
