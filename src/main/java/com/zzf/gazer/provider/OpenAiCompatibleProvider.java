package com.zzf.gazer.provider;

import com.zzf.gazer.catalog.ModelCatalog;
import com.zzf.gazer.model.CompletionRequest;
import com.zzf.gazer.model.Message;
import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.model.Tool;

import java.util.List;
import java.util.Map;

/**
 * Any backend that speaks the OpenAI chat-completions API as-is.
 */
public class OpenAiCompatibleProvider implements Provider {

    public static final String TYPE = "openai-compatible";

    private final String name;
    private final String defaultModel;
    private final ChatCompletionClient client;
    private final ModelCatalog catalog;

    public OpenAiCompatibleProvider(String name, String defaultModel, ChatCompletionClient client, ModelCatalog catalog) {
        this.name = name;
        this.defaultModel = defaultModel;
        this.client = client;
        this.catalog = catalog;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletionRequest createRequest(boolean stream, List<Message> messages, List<Tool> tools,
                                           ModelInfo model, ModelParams params, boolean webSearch) {
        return client.createRequest(stream, messages, tools, model, params, webSearch);
    }

    @Override
    public Completion ask(CompletionRequest request, Map<String, String> headers) {
        return client.ask(request, headers);
    }

    @Override
    public StreamingCompletion askStream(CompletionRequest request, Map<String, String> headers) {
        return client.askStream(request, headers);
    }

    @Override
    public Map<String, ModelInfo> getModels(boolean onlyFree, boolean forceFresh) {
        return catalog.getModels(onlyFree, forceFresh);
    }

    @Override
    public ModelInfo getModelInfo(String name) {
        return catalog.getModelInfo(name);
    }

    @Override
    public String getDefaultModel() {
        return defaultModel;
    }
}
