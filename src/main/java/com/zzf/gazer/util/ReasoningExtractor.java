package com.zzf.gazer.util;

import lombok.Value;

/**
 * Splits reasoning that a model wrote inline into its answer.
 * Recognised forms: a {@code Reasoning:} marker, {@code <reasoning>} tags and a {@code ```reasoning} fence.
 */
public final class ReasoningExtractor {

    private static final String MARKER = "Reasoning:";
    private static final String OPEN_TAG = "<reasoning>";
    private static final String CLOSE_TAG = "</reasoning>";
    private static final String FENCE_OPEN = "```reasoning";
    private static final String FENCE = "```";

    private ReasoningExtractor() {}

    @Value
    public static class Split {
        String content;
        String reasoning;
    }

    public static Split split(String text) {
        if (text == null) {
            return new Split("", "");
        }
        if (text.contains(MARKER)) {
            int at = text.indexOf(MARKER);
            return new Split(text.substring(0, at).trim(), text.substring(at + MARKER.length()).trim());
        }
        if (text.contains(OPEN_TAG)) {
            int start = text.indexOf(OPEN_TAG);
            int end = text.indexOf(CLOSE_TAG, start);
            if (end > start) {
                String reasoning = text.substring(start + OPEN_TAG.length(), end).trim();
                String content = (text.substring(0, start) + text.substring(end + CLOSE_TAG.length())).trim();
                return new Split(content, reasoning);
            }
            return new Split(text, "");
        }
        if (text.contains(FENCE_OPEN)) {
            int start = text.indexOf(FENCE_OPEN);
            int end = text.indexOf(FENCE, start + FENCE_OPEN.length());
            if (end > start) {
                String reasoning = text.substring(start + FENCE_OPEN.length(), end).trim();
                String content = (text.substring(0, start) + text.substring(end + FENCE.length())).trim();
                return new Split(content, reasoning);
            }
        }
        return new Split(text, "");
    }
}
