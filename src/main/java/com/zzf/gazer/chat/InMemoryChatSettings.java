package com.zzf.gazer.chat;

import com.zzf.gazer.config.AiProperties;
import com.zzf.gazer.model.ModelParams;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ChatSettings}. Nothing survives a restart.
 */
@Slf4j
public class InMemoryChatSettings implements ChatSettings {

    private final AiProperties properties;
    private final Map<Long, String> modelSpecs = new ConcurrentHashMap<>();
    private final Map<Long, ModelParams> chatParams = new ConcurrentHashMap<>();

    public InMemoryChatSettings(AiProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> currentModelSpec(long chatId) {
        return Optional.ofNullable(modelSpecs.get(chatId));
    }

    public void setModelSpec(long chatId, String spec) {
        if (spec == null || spec.isEmpty()) {
            modelSpecs.remove(chatId);
        } else {
            modelSpecs.put(chatId, spec);
        }
        log.debug("chat model updated chatId={} spec={}", chatId, spec);
    }

    /**
     * Stores params for the chat. Fields already stored and absent here are kept; null changes nothing.
     */
    public void updateParams(long chatId, ModelParams params) {
        if (params == null) {
            return;
        }
        params.validate();
        chatParams.merge(chatId, params, ModelParams::merge);
    }

    public void clear(long chatId) {
        modelSpecs.remove(chatId);
        chatParams.remove(chatId);
    }

    @Override
    public ModelParams mergeModelParams(long chatId, String provider, String alias, String prompt,
                                        ModelParams requestParams) {
        ModelParams merged = properties.fullModelParams(provider, alias, prompt);
        ModelParams stored = chatParams.get(chatId);
        if (stored != null) {
            merged = merged.merge(stored);
        }
        return merged.merge(requestParams);
    }
}
