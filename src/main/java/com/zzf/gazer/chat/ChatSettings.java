package com.zzf.gazer.chat;

import com.zzf.gazer.model.ModelParams;

import java.util.Optional;

/**
 * Per-chat model choice and parameter overrides, kept outside the provider layer.
 */
public interface ChatSettings {

    /**
     * The {@code provider:model} spec persisted for the chat, if any.
     */
    Optional<String> currentModelSpec(long chatId);

    /**
     * Configuration defaults for (provider, alias, prompt), then the chat's stored params, then {@code requestParams}.
     *
     * @throws IllegalArgumentException when a configured layer is invalid
     */
    ModelParams mergeModelParams(long chatId, String provider, String alias, String prompt, ModelParams requestParams);
}
