package com.zzf.gazer.stream;

import com.zzf.gazer.model.FunctionCall;
import com.zzf.gazer.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ToolCallAccumulatorTest {

    private static ToolCall fragment(int index, String id, String type, String name, String args) {
        return ToolCall.builder().index(index).id(id).type(type).function(new FunctionCall(name, args)).build();
    }

    @Test
    public void testArgumentsConcatenateAndLateIdIsKept() {
        ToolCallAccumulator acc = new ToolCallAccumulator();
        acc.accept(fragment(0, null, null, null, "{\"a\""));
        acc.accept(fragment(0, null, null, null, ":1}"));
        acc.accept(fragment(0, "call_1", "function", "f", null));

        List<ToolCall> calls = acc.drain();

        assertEquals(1, calls.size());
        assertEquals("{\"a\":1}", calls.get(0).arguments());
        assertEquals("call_1", calls.get(0).getId());
        assertEquals("function", calls.get(0).getType());
        assertEquals("f", calls.get(0).functionName());
    }

    @Test
    public void testEmptyValuesNeverOverwrite() {
        ToolCallAccumulator acc = new ToolCallAccumulator();
        acc.accept(fragment(0, "call_1", "function", "search", "{"));
        acc.accept(fragment(0, "", "", "", "}"));

        ToolCall call = acc.drain().get(0);

        assertEquals("call_1", call.getId());
        assertEquals("search", call.functionName());
        assertEquals("{}", call.arguments());
    }

    @Test
    public void testLastNonEmptyWriteWins() {
        ToolCallAccumulator acc = new ToolCallAccumulator();
        acc.accept(fragment(0, "call_a", "function", "f", ""));
        acc.accept(fragment(0, "call_b", null, null, ""));

        assertEquals("call_b", acc.drain().get(0).getId());
    }

    @Test
    public void testInterleavedSlotsAreKeptApartAndOrdered() {
        ToolCallAccumulator acc = new ToolCallAccumulator();
        acc.accept(fragment(1, "call_2", "function", "weather", "{\"location\":"));
        acc.accept(fragment(0, "call_1", "function", "search", "{\"query\":"));
        acc.accept(fragment(1, null, null, null, "\"Paris\"}"));
        acc.accept(fragment(0, null, null, null, "\"news\"}"));

        List<ToolCall> calls = acc.drain();

        assertEquals(2, calls.size());
        assertEquals("search", calls.get(0).functionName());
        assertEquals("{\"query\":\"news\"}", calls.get(0).arguments());
        assertEquals("{\"location\":\"Paris\"}", calls.get(1).arguments());
    }

    @Test
    public void testDrainStartsFresh() {
        ToolCallAccumulator acc = new ToolCallAccumulator();
        acc.accept(fragment(0, "call_1", "function", "f", "{}"));
        acc.drain();

        assertTrue(acc.isEmpty());
        acc.accept(fragment(0, "call_2", "function", "g", "{}"));
        assertEquals("call_2", acc.drain().get(0).getId());
    }
}
