package com.zzf.gazer.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.gazer.error.AiException;
import com.zzf.gazer.model.Chunk;
import com.zzf.gazer.model.StreamEvent;
import com.zzf.gazer.model.ToolCall;
import com.zzf.gazer.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Decodes a {@code text/event-stream} completion body into chunks.
 * One instance per stream: it carries the in-progress tool-call slots between events.
 */
@Slf4j
public class StreamDecoder {

    public static final String DATA_PREFIX = "data:";
    public static final String DONE = "[DONE]";

    private static final int MAX_LOGGED_LINE = 500;

    private final ObjectMapper objectMapper;
    private final String providerName;
    private final String modelName;
    private final ToolCallAccumulator toolCalls = new ToolCallAccumulator();
    private boolean done;

    public StreamDecoder(ObjectMapper objectMapper, String providerName, String modelName) {
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.modelName = modelName;
    }

    /**
     * Starts a producer on {@code executor} that decodes {@code body} into the returned stream.
     * The body is closed when the producer exits, whatever the reason.
     */
    public ChunkStream start(InputStream body, Executor executor) {
        ChunkStream sink = new ChunkStream();
        sink.onCancel(() -> closeBody(body));
        executor.execute(() -> pump(body, sink));
        return sink;
    }

    void pump(InputStream body, ChunkStream sink) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while (!sink.isCancelled() && (line = reader.readLine()) != null) {
                decodeLine(line).ifPresent(sink::push);
                if (done) {
                    break;
                }
            }
        } catch (IOException e) {
            if (sink.isCancelled()) {
                log.debug("stream closed after cancellation provider={} model={}", providerName, modelName);
            } else {
                log.warn("stream read error provider={} model={}: {}", providerName, modelName, e.toString());
            }
        } catch (RuntimeException e) {
            log.error("stream producer failed provider={} model={}", providerName, modelName, e);
        } finally {
            closeBody(body);
            sink.finish();
        }
    }

    /**
     * Decodes one line of the event stream. Non-data lines, the terminator and malformed payloads yield nothing.
     */
    public Optional<Chunk> decodeLine(String line) {
        if (done || line == null || !line.startsWith(DATA_PREFIX)) {
            return Optional.empty();
        }
        String data = line.substring(DATA_PREFIX.length()).trim();
        if (data.isEmpty()) {
            return Optional.empty();
        }
        if (DONE.equals(data)) {
            done = true;
            return Optional.empty();
        }
        log.trace("raw stream event provider={} model={} data={}", providerName, modelName, data);

        StreamEvent event;
        try {
            event = objectMapper.readValue(data, StreamEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("stream decode error provider={} model={} data={} err={}",
                    providerName, modelName, JsonUtils.truncateForLog(data, MAX_LOGGED_LINE), e.getOriginalMessage());
            return Optional.empty();
        }
        return Optional.of(toChunk(event));
    }

    public boolean isDone() {
        return done;
    }

    Chunk toChunk(StreamEvent event) {
        Chunk.ChunkBuilder chunk = Chunk.builder().usage(event.getUsage());
        if (event.getChoices() == null || event.getChoices().isEmpty()) {
            if (event.getError() != null) {
                chunk.error(inStreamError(event, null));
            }
            return chunk.build();
        }

        StreamEvent.Choice choice = event.getChoices().get(0);
        StreamEvent.Delta delta = choice.getDelta();
        if (delta != null) {
            if (delta.getToolCalls() != null) {
                for (ToolCall fragment : delta.getToolCalls()) {
                    toolCalls.accept(fragment);
                }
            }
            if (delta.getContent() != null) {
                chunk.content(delta.getContent());
            }
            String reasoning = delta.getReasoning();
            if (reasoning == null || reasoning.isEmpty()) {
                reasoning = delta.getReasoningContent();
            }
            if (reasoning != null) {
                chunk.reasoning(reasoning);
            }
            if (delta.getAnnotations() != null) {
                chunk.annotations(delta.getAnnotations());
            }
        }

        String finishReason = choice.getFinishReason();
        chunk.finishReason(finishReason);
        if (StreamEvent.FINISH_TOOL_CALLS.equals(finishReason)) {
            chunk.toolCalls(toolCalls.drain());
        } else if (StreamEvent.FINISH_ERROR.equals(finishReason) || event.getError() != null) {
            chunk.error(inStreamError(event, finishReason));
        }
        return chunk.build();
    }

    private AiException inStreamError(StreamEvent event, String finishReason) {
        AiException.AiExceptionBuilder error = AiException.builder()
                .providerName(providerName)
                .modelName(modelName)
                .detail("stream generation failed: " + (finishReason == null ? "error" : finishReason));
        if (event.getError() != null) {
            if (event.getError().getMessage() != null && !event.getError().getMessage().isEmpty()) {
                error.detail(event.getError().getMessage());
            }
            error.errorCode(event.getError().getCode());
        }
        return error.build();
    }

    private void closeBody(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("failed to close stream body provider={} model={}: {}", providerName, modelName, e.toString());
        }
    }
}
