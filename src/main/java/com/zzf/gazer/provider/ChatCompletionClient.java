package com.zzf.gazer.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.gazer.error.AiException;
import com.zzf.gazer.model.CompletionRequest;
import com.zzf.gazer.model.CompletionResponse;
import com.zzf.gazer.model.Message;
import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.model.Plugin;
import com.zzf.gazer.model.Tool;
import com.zzf.gazer.stream.ChunkStream;
import com.zzf.gazer.stream.StreamDecoder;
import com.zzf.gazer.transport.ApiTransport;
import com.zzf.gazer.util.JsonUtils;
import com.zzf.gazer.util.ReasoningExtractor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * OpenAI-style chat-completions client shared by the providers: builds requests, performs blocking and
 * streamed round trips and lists models. Every failure is rethrown as {@link AiException}.
 */
@Slf4j
public class ChatCompletionClient {

    public static final String DEFAULT_CHAT_URL = "/chat/completions";
    public static final String MODELS_URL = "models";
    public static final int WEB_SEARCH_MAX_RESULTS = 2;

    private static final int MAX_LOGGED_ERROR_BODY = 1000;

    private final String providerName;
    private final ApiTransport transport;
    private final ObjectMapper objectMapper;
    private final Executor streamExecutor;
    private final String chatUrl;

    public ChatCompletionClient(String providerName, ApiTransport transport, ObjectMapper objectMapper,
                                Executor streamExecutor, String chatUrl) {
        this.providerName = providerName;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
        this.chatUrl = chatUrl == null || chatUrl.isEmpty() ? DEFAULT_CHAT_URL : chatUrl;
    }

    public String getProviderName() {
        return providerName;
    }

    public CompletionRequest createRequest(boolean stream, List<Message> messages, List<Tool> tools,
                                           ModelInfo model, ModelParams params, boolean webSearch) {
        ModelParams p = params == null ? ModelParams.EMPTY : params;
        CompletionRequest.CompletionRequestBuilder request = CompletionRequest.builder()
                .model(model == null ? null : model.getId())
                .messages(messages)
                .stream(stream)
                .temperature(p.getTemperature())
                .maxTokens(p.getMaxTokens())
                .topP(p.getTopP())
                .frequencyPenalty(p.getFrequencyPenalty())
                .presencePenalty(p.getPresencePenalty())
                .stop(p.getStopSequences())
                .reasoning(p.getReasoning())
                .usage(new CompletionRequest.UsageOptions(true))
                .modelInfo(model)
                .webSearch(webSearch);

        if (tools != null && !tools.isEmpty()) {
            request.tools(tools);
        }

        List<Plugin> plugins = new ArrayList<>();
        if (webSearch) {
            plugins.add(Plugin.web(WEB_SEARCH_MAX_RESULTS));
        }
        boolean hasFiles = messages != null && messages.stream().anyMatch(Message::hasFiles);
        if (hasFiles) {
            boolean nativeFiles = model != null && model.supportsFiles();
            plugins.add(Plugin.fileParser(nativeFiles ? Plugin.ENGINE_NATIVE : Plugin.ENGINE_PDF_TEXT));
        }
        if (!plugins.isEmpty()) {
            request.plugins(plugins);
        }
        return request.build();
    }

    public Completion ask(CompletionRequest request, Map<String, String> headers) {
        String model = request.getModel();
        HttpResponse<InputStream> response = send("POST", chatUrl, request, headers, model);
        String body = readBody(response, model);
        if (!isSuccess(response.statusCode())) {
            throw statusError(response.statusCode(), body, model);
        }

        CompletionResponse result;
        try {
            result = objectMapper.readValue(body, CompletionResponse.class);
        } catch (JsonProcessingException e) {
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .httpStatus(response.statusCode())
                    .detail("failed to unmarshal response")
                    .cause(e)
                    .build();
        }

        // some providers report failures inside a 200 body
        if (result.getError() != null) {
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .errorCode(result.getError().getCode())
                    .detail(result.getError().getMessage())
                    .build();
        }
        if (result.getChoices() == null || result.getChoices().isEmpty()) {
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .detail("no choices in response")
                    .build();
        }

        CompletionResponse.ResponseMessage message = result.getChoices().get(0).getMessage();
        String content = message == null || message.getContent() == null ? "" : message.getContent();
        String reasoning = message == null ? "" : message.effectiveReasoning();
        if (reasoning.isEmpty()) {
            ReasoningExtractor.Split split = ReasoningExtractor.split(content);
            content = split.getContent();
            reasoning = split.getReasoning();
        }
        return Completion.builder()
                .content(content)
                .reasoning(reasoning)
                .response(result)
                .model(request.getModelInfo())
                .build();
    }

    public StreamingCompletion askStream(CompletionRequest request, Map<String, String> headers) {
        String model = request.getModel();
        Map<String, String> streamHeaders = headers == null ? new HashMap<>() : new HashMap<>(headers);
        streamHeaders.put("Accept", "text/event-stream");

        HttpResponse<InputStream> response = send("POST", chatUrl, request, streamHeaders, model);
        if (!isSuccess(response.statusCode())) {
            String body = readBody(response, model);
            throw statusError(response.statusCode(), body, model);
        }

        InputStream body = response.body();
        ChunkStream chunks;
        try {
            chunks = new StreamDecoder(objectMapper, providerName, model).start(body, streamExecutor);
        } catch (RejectedExecutionException e) {
            closeQuietly(body);
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .detail("failed to start stream producer")
                    .cause(e)
                    .build();
        }
        return StreamingCompletion.builder()
                .chunks(chunks)
                .model(request.getModelInfo())
                .build();
    }

    /**
     * Lists models from the provider's {@code models} endpoint, owned by this provider.
     */
    public List<ModelInfo> fetchModels() {
        HttpResponse<InputStream> response = send("GET", MODELS_URL, null, null, null);
        String body = readBody(response, null);
        if (!isSuccess(response.statusCode())) {
            throw statusError(response.statusCode(), body, null);
        }
        try {
            JsonNode data = objectMapper.readTree(body).path("data");
            List<ModelInfo> models = new ArrayList<>();
            if (data.isArray()) {
                for (JsonNode node : data) {
                    models.add(objectMapper.treeToValue(node, ModelInfo.class).withProvider(providerName));
                }
            }
            return models;
        } catch (JsonProcessingException e) {
            throw AiException.builder()
                    .providerName(providerName)
                    .httpStatus(response.statusCode())
                    .detail("decode models error")
                    .cause(e)
                    .build();
        }
    }

    private HttpResponse<InputStream> send(String method, String endpoint, Object body,
                                           Map<String, String> headers, String model) {
        try {
            return transport.send(method, endpoint, body, headers);
        } catch (JsonProcessingException e) {
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .detail("failed to encode request")
                    .cause(e)
                    .build();
        } catch (IOException e) {
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .detail("network request failed")
                    .cause(e)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .detail("request interrupted")
                    .cause(e)
                    .build();
        }
    }

    private String readBody(HttpResponse<InputStream> response, String model) {
        try (InputStream in = response.body()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw AiException.builder()
                    .providerName(providerName)
                    .modelName(model)
                    .detail("failed to read response body")
                    .cause(e)
                    .build();
        }
    }

    AiException statusError(int status, String body, String model) {
        String detail = "HTTP request failed with status code: " + status;
        String code = null;
        if (body != null && !body.isEmpty()) {
            try {
                JsonNode error = objectMapper.readTree(body).path("error");
                String message = error.path("message").asText("");
                if (!message.isEmpty()) {
                    detail = message;
                    code = error.hasNonNull("code") ? error.get("code").asText() : null;
                }
            } catch (JsonProcessingException e) {
                log.debug("non-JSON error body provider={} status={} body={}",
                        providerName, status, JsonUtils.truncateForLog(body, MAX_LOGGED_ERROR_BODY));
            }
        }
        return AiException.builder()
                .providerName(providerName)
                .modelName(model)
                .httpStatus(status)
                .errorCode(code)
                .detail(detail)
                .build();
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("failed to close response body provider={}: {}", providerName, e.toString());
        }
    }
}
