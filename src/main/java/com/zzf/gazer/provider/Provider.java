package com.zzf.gazer.provider;

import com.zzf.gazer.model.CompletionRequest;
import com.zzf.gazer.model.Message;
import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.model.Tool;

import java.util.List;
import java.util.Map;

/**
 * A chat-completion backend reachable over an OpenAI-style HTTP API.
 * Every failure of {@link #ask} and {@link #askStream} is an {@link com.zzf.gazer.error.AiException}.
 */
public interface Provider {

    String getName();

    /**
     * Assembles the wire request. Tools are omitted when {@code tools} is empty, a web plugin is added when
     * {@code webSearch} is set and a file-parser plugin when any message carries a file.
     */
    CompletionRequest createRequest(boolean stream, List<Message> messages, List<Tool> tools,
                                    ModelInfo model, ModelParams params, boolean webSearch);

    Completion ask(CompletionRequest request, Map<String, String> headers);

    /**
     * Opens a streamed completion. Reachability and the response status are checked before this returns;
     * chunks are decoded on a background producer.
     */
    StreamingCompletion askStream(CompletionRequest request, Map<String, String> headers);

    Map<String, ModelInfo> getModels(boolean onlyFree, boolean forceFresh);

    /**
     * @throws com.zzf.gazer.error.ModelNotFoundException when the provider does not know the model
     */
    ModelInfo getModelInfo(String name);

    String getDefaultModel();
}
