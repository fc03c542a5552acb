package com.zzf.gazer.provider;

import com.zzf.gazer.catalog.ModelCatalog;
import com.zzf.gazer.error.AiException;
import com.zzf.gazer.error.ModelNotFoundException;
import com.zzf.gazer.model.CompletionRequest;
import com.zzf.gazer.model.Message;
import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.model.Tool;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * OpenRouter aggregator. Adds the {@code random-free} model name, routing preferences for streams,
 * an application title header and an optional free-models-only mode (configured on the catalog).
 */
@Slf4j
public class OpenRouterProvider implements Provider {

    public static final String TYPE = "openrouter";
    public static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    public static final String RANDOM_FREE_MODEL = "random-free";
    public static final String TITLE_HEADER = "X-Title";
    public static final String APP_TITLE = "Gazer";

    private final String name;
    private final String defaultModel;
    private final ChatCompletionClient client;
    private final ModelCatalog catalog;
    private final Random random;

    public OpenRouterProvider(String name, String defaultModel, ChatCompletionClient client, ModelCatalog catalog) {
        this(name, defaultModel, client, catalog, new Random());
    }

    public OpenRouterProvider(String name, String defaultModel, ChatCompletionClient client, ModelCatalog catalog,
                              Random random) {
        this.name = name;
        this.defaultModel = defaultModel;
        this.client = client;
        this.catalog = catalog;
        this.random = random;
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
        return client.ask(withConcreteModel(request), withTitle(headers));
    }

    @Override
    public StreamingCompletion askStream(CompletionRequest request, Map<String, String> headers) {
        CompletionRequest concrete = withConcreteModel(request);
        ModelInfo model = concrete.getModelInfo();
        String sort = model != null && model.isFree()
                ? CompletionRequest.Routing.SORT_THROUGHPUT
                : CompletionRequest.Routing.SORT_PRICE;
        CompletionRequest routed = concrete.toBuilder()
                .provider(new CompletionRequest.Routing(sort, false))
                .build();
        return client.askStream(routed, withTitle(headers));
    }

    @Override
    public Map<String, ModelInfo> getModels(boolean onlyFree, boolean forceFresh) {
        return catalog.getModels(onlyFree, forceFresh);
    }

    @Override
    public ModelInfo getModelInfo(String name) {
        if (RANDOM_FREE_MODEL.equals(name)) {
            String picked;
            try {
                picked = getRandomFreeModel();
            } catch (IllegalStateException e) {
                log.warn("cannot resolve {} provider={}: {}", RANDOM_FREE_MODEL, this.name, e.getMessage());
                throw new ModelNotFoundException(ModelInfo.placeholder(name, this.name));
            }
            return catalog.getModelInfo(picked);
        }
        return catalog.getModelInfo(name);
    }

    @Override
    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Picks one free model id uniformly at random.
     *
     * @throws IllegalStateException when the catalog has no free models
     */
    public String getRandomFreeModel() {
        List<String> ids = new ArrayList<>(getModels(true, false).keySet());
        if (ids.isEmpty()) {
            throw new IllegalStateException("no free models available");
        }
        Collections.sort(ids);
        return ids.get(random.nextInt(ids.size()));
    }

    private CompletionRequest withConcreteModel(CompletionRequest request) {
        String model = request.getModel();
        String concrete;
        if (model == null || model.isEmpty()) {
            concrete = defaultModel;
        } else if (RANDOM_FREE_MODEL.equals(model)) {
            try {
                concrete = getRandomFreeModel();
            } catch (IllegalStateException e) {
                throw AiException.builder()
                        .providerName(name)
                        .modelName(model)
                        .detail("failed to get random free model: " + e.getMessage())
                        .cause(e)
                        .build();
            }
        } else {
            return request;
        }
        log.debug("substituted model provider={} requested={} actual={}", name, model, concrete);
        return request.toBuilder()
                .model(concrete)
                .modelInfo(lookup(concrete))
                .build();
    }

    private ModelInfo lookup(String model) {
        try {
            return catalog.getModelInfo(model);
        } catch (ModelNotFoundException e) {
            return e.getPlaceholder();
        }
    }

    private static Map<String, String> withTitle(Map<String, String> headers) {
        Map<String, String> result = headers == null ? new HashMap<>() : new HashMap<>(headers);
        result.put(TITLE_HEADER, APP_TITLE);
        return result;
    }
}
