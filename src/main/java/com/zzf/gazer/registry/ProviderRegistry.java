package com.zzf.gazer.registry;

import com.zzf.gazer.chat.ChatSettings;
import com.zzf.gazer.config.AiProperties;
import com.zzf.gazer.error.ModelNotFoundException;
import com.zzf.gazer.error.ModelResolutionException;
import com.zzf.gazer.model.CompletionRequest;
import com.zzf.gazer.model.Message;
import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.model.Tool;
import com.zzf.gazer.provider.Completion;
import com.zzf.gazer.provider.ModelSpec;
import com.zzf.gazer.provider.Provider;
import com.zzf.gazer.provider.StreamingCompletion;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registered providers in registration order, model resolution and request dispatch.
 */
@Slf4j
public class ProviderRegistry {

    private final AiProperties properties;
    private final Map<String, Provider> providers = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile ChatSettings chatSettings;

    public ProviderRegistry(AiProperties properties) {
        this.properties = properties;
    }

    public void setChatSettings(ChatSettings chatSettings) {
        this.chatSettings = chatSettings;
    }

    public void register(Provider provider) {
        lock.writeLock().lock();
        try {
            providers.put(provider.getName(), provider);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("registered AI provider name={}", provider.getName());
    }

    /**
     * @throws ModelResolutionException with {@code PROVIDER_NOT_FOUND} for an unknown name
     */
    public Provider getProvider(String name) {
        return findProvider(name).orElseThrow(() -> ModelResolutionException.providerNotFound(name));
    }

    public List<String> providers() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(providers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Picks the provider and model for a request. Tried in order: the explicit {@code modelSpec},
     * the spec stored for {@code chatId} (when non-zero), the configured default.
     * A stored chat spec that cannot be used is skipped.
     *
     * @throws ModelResolutionException when the explicit or default spec is malformed or names an unknown provider
     */
    public ResolvedModel resolveModel(String modelSpec, long chatId) {
        if (modelSpec != null && !modelSpec.isEmpty()) {
            ModelSpec spec = ModelSpec.parse(modelSpec);
            return new ResolvedModel(getProvider(spec.getProvider()), spec.getModel());
        }

        ChatSettings settings = chatSettings;
        if (chatId != 0 && settings != null) {
            Optional<ResolvedModel> fromChat = resolveChatModel(settings, chatId);
            if (fromChat.isPresent()) {
                return fromChat.get();
            }
        }

        ModelSpec spec = ModelSpec.parse(properties.getDefaultModel());
        return new ResolvedModel(getProvider(spec.getProvider()), spec.getModel());
    }

    private Optional<ResolvedModel> resolveChatModel(ChatSettings settings, long chatId) {
        Optional<String> stored;
        try {
            stored = settings.currentModelSpec(chatId);
        } catch (RuntimeException e) {
            log.warn("failed to read chat model, using default chatId={}: {}", chatId, e.toString());
            return Optional.empty();
        }
        if (stored.isEmpty() || !ModelSpec.isValid(stored.get())) {
            return Optional.empty();
        }
        ModelSpec spec = ModelSpec.parse(stored.get());
        Optional<Provider> provider = findProvider(spec.getProvider());
        if (provider.isEmpty()) {
            log.debug("chat model names unknown provider chatId={} spec={}", chatId, spec);
            return Optional.empty();
        }
        return Optional.of(new ResolvedModel(provider.get(), spec.getModel()));
    }

    /**
     * Blocking completion. When {@code model} is null it is resolved from the chat or the default.
     */
    public Completion ask(List<Message> messages, List<Tool> tools, ModelInfo model, String promptName,
                          long chatId, boolean webSearch, ModelParams requestParams) {
        Target target = target(model, chatId);
        ModelParams params = mergeParams(chatId, target.model, promptName, requestParams);
        CompletionRequest request = target.provider.createRequest(false, messages, tools, target.model, params, webSearch);
        Completion completion = target.provider.ask(request, null);
        return completion.toBuilder().params(params).build();
    }

    public StreamingCompletion askStream(List<Message> messages, List<Tool> tools, ModelInfo model, String promptName,
                                         long chatId, boolean webSearch, ModelParams requestParams) {
        Target target = target(model, chatId);
        ModelParams params = mergeParams(chatId, target.model, promptName, requestParams);
        CompletionRequest request = target.provider.createRequest(true, messages, tools, target.model, params, webSearch);
        StreamingCompletion completion = target.provider.askStream(request, null);
        return completion.toBuilder().params(params).build();
    }

    /**
     * Looks a model up by name. Aliases are expanded first; with a known provider (given, or embedded as
     * {@code provider:model}) only that provider is asked, otherwise every provider in registration order.
     *
     * @throws ModelNotFoundException when no provider knows the model
     */
    public ModelInfo getFormattedModel(String modelName, String providerName) {
        log.debug("get model info model={} provider={}", modelName, providerName);
        String aliasName = null;
        Optional<AiProperties.AliasProperties> alias = properties.getAlias(modelName);
        if (alias.isPresent()) {
            aliasName = modelName;
            modelName = alias.get().getModel();
        }
        if ((providerName == null || providerName.isEmpty()) && ModelSpec.isValid(modelName)) {
            ModelSpec spec = ModelSpec.parse(modelName);
            providerName = spec.getProvider();
            modelName = spec.getModel();
        }

        ModelInfo model = null;
        if (providerName != null && !providerName.isEmpty()) {
            Optional<Provider> provider = findProvider(providerName);
            if (provider.isPresent()) {
                model = provider.get().getModelInfo(modelName);
            }
        }
        if (model == null) {
            model = probe(modelName);
        }
        return aliasName == null ? model : model.withAlias(aliasName);
    }

    private ModelInfo probe(String modelName) {
        for (String name : providers()) {
            Optional<Provider> provider = findProvider(name);
            if (provider.isEmpty()) {
                continue;
            }
            try {
                return provider.get().getModelInfo(modelName);
            } catch (RuntimeException e) {
                log.debug("provider does not resolve model provider={} model={}: {}", name, modelName, e.getMessage());
            }
        }
        throw new ModelNotFoundException(ModelInfo.placeholder(modelName, null));
    }

    /**
     * Catalog of every provider. A provider that fails is logged and left out, as is one with no models.
     */
    public Map<String, List<ModelInfo>> getAllModels(boolean free, boolean fresh) {
        Map<String, List<ModelInfo>> result = new LinkedHashMap<>();
        for (String name : providers()) {
            Optional<Provider> provider = findProvider(name);
            if (provider.isEmpty()) {
                continue;
            }
            Map<String, ModelInfo> models;
            try {
                models = provider.get().getModels(free, fresh);
            } catch (RuntimeException e) {
                log.error("get models error provider={}", name, e);
                continue;
            }
            if (!models.isEmpty()) {
                result.put(name, new ArrayList<>(models.values()));
            }
        }
        return result;
    }

    private Optional<Provider> findProvider(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    private Target target(ModelInfo model, long chatId) {
        if (model != null) {
            return new Target(resolveModel(model.fullName(), chatId).getProvider(), model);
        }
        ResolvedModel resolved = resolveModel(null, chatId);
        ModelInfo info;
        try {
            info = resolved.getProvider().getModelInfo(resolved.getModelName());
        } catch (ModelNotFoundException e) {
            info = e.getPlaceholder();
        }
        return new Target(resolved.getProvider(), info);
    }

    private ModelParams mergeParams(long chatId, ModelInfo model, String promptName, ModelParams requestParams) {
        ChatSettings settings = chatSettings;
        if (settings != null) {
            return settings.mergeModelParams(chatId, model.getProvider(), model.getAlias(), promptName, requestParams);
        }
        return properties.fullModelParams(model.getProvider(), model.getAlias(), promptName).merge(requestParams);
    }

    private static final class Target {
        private final Provider provider;
        private final ModelInfo model;

        private Target(Provider provider, ModelInfo model) {
            this.provider = provider;
            this.model = model;
        }
    }
}
