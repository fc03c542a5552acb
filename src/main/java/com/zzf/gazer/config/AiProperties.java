package com.zzf.gazer.config;

import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.model.ReasoningParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * {@code gazer.ai.*} settings: providers, model aliases, prompts and the layered generation defaults.
 */
@Data
@ConfigurationProperties(prefix = "gazer.ai")
public class AiProperties {

    /**
     * Global fallback model as {@code provider:model}.
     */
    private String defaultModel;
    private ModelParamsProperties modelParams = new ModelParamsProperties();
    /**
     * Enables the image generation tool when set.
     */
    private String imageRouterApiKey;
    private Duration requestTimeout = Duration.ofMinutes(3);
    private boolean warmUpCatalogs = true;
    private List<ProviderProperties> providers = new ArrayList<>();
    private List<AliasProperties> aliases = new ArrayList<>();
    private List<PromptProperties> prompts = new ArrayList<>();

    public Optional<ProviderProperties> getProvider(String name) {
        return providers.stream().filter(p -> p.getName() != null && p.getName().equals(name)).findFirst();
    }

    public Optional<AliasProperties> getAlias(String alias) {
        return aliases.stream().filter(a -> a.getAlias() != null && a.getAlias().equals(alias)).findFirst();
    }

    /**
     * Looks a prompt up by its name or any of its aliases.
     */
    public Optional<PromptProperties> getPrompt(String nameOrAlias) {
        return prompts.stream()
                .filter(p -> nameOrAlias.equals(p.getName()) || p.getAliases().contains(nameOrAlias))
                .findFirst();
    }

    /**
     * Configuration defaults for a request: global, then provider, then alias, then prompt.
     *
     * @throws IllegalArgumentException when a layer holds an out-of-range value
     */
    public ModelParams fullModelParams(String providerName, String aliasName, String promptName) {
        ModelParams params = validated("global", modelParams.toModelParams());
        if (providerName != null && !providerName.isEmpty()) {
            Optional<ProviderProperties> provider = getProvider(providerName);
            if (provider.isPresent()) {
                params = params.merge(validated("provider", provider.get().getModelParams().toModelParams()));
            }
        }
        if (aliasName != null && !aliasName.isEmpty()) {
            Optional<AliasProperties> alias = getAlias(aliasName);
            if (alias.isPresent()) {
                params = params.merge(validated("alias", alias.get().getModelParams().toModelParams()));
            }
        }
        if (promptName != null && !promptName.isEmpty()) {
            Optional<PromptProperties> prompt = getPrompt(promptName);
            if (prompt.isPresent()) {
                params = params.merge(validated("prompt", prompt.get().getModelParams().toModelParams()));
            }
        }
        return params;
    }

    private static ModelParams validated(String layer, ModelParams params) {
        try {
            params.validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(layer + " params: " + e.getMessage(), e);
        }
        return params;
    }

    @Data
    public static class ProviderProperties {
        /**
         * {@code openrouter}, {@code openai-compatible} or {@code local}.
         */
        private String type;
        private String name;
        private String baseUrl;
        private String chatUrl;
        private String apiKey;
        /**
         * Environment variable read when {@link #apiKey} is empty.
         */
        private String envApiKey;
        private String defaultModel;
        private boolean onlyFreeModels;
        /**
         * Serve the model list from {@link #models} only.
         */
        private boolean overrideModels;
        private ModelParamsProperties modelParams = new ModelParamsProperties();
        private List<ModelProperties> models = new ArrayList<>();

        public String resolveApiKey(UnaryOperator<String> env) {
            if (apiKey != null && !apiKey.isEmpty()) {
                return apiKey;
            }
            if (envApiKey == null || envApiKey.isEmpty()) {
                return "";
            }
            String value = env.apply(envApiKey);
            return value == null ? "" : value;
        }

        public List<ModelInfo> configuredModels() {
            List<ModelInfo> result = new ArrayList<>();
            for (ModelProperties model : models) {
                result.add(model.toModelInfo(name));
            }
            return result;
        }
    }

    @Data
    public static class ModelProperties {
        private String model;
        private List<String> inputModalities = new ArrayList<>();
        private List<String> outputModalities = new ArrayList<>();
        private List<String> supportedParameters = new ArrayList<>();
        private boolean free;

        public ModelInfo toModelInfo(String provider) {
            return ModelInfo.builder()
                    .id(model)
                    .provider(provider)
                    .architecture(ModelInfo.Architecture.builder()
                            .inputModalities(inputModalities)
                            .outputModalities(outputModalities)
                            .build())
                    .supportedParameters(supportedParameters)
                    .pricing(free ? ModelInfo.Pricing.FREE : null)
                    .build();
        }
    }

    @Data
    public static class AliasProperties {
        private String alias;
        /**
         * Target model, with or without a provider prefix.
         */
        private String model;
        private ModelParamsProperties modelParams = new ModelParamsProperties();
    }

    @Data
    public static class PromptProperties {
        private String name;
        private List<String> aliases = new ArrayList<>();
        private ModelParamsProperties modelParams = new ModelParamsProperties();
    }

    @Data
    public static class ModelParamsProperties {
        private Boolean stream;
        private Double temperature;
        private Integer maxTokens;
        private Double topP;
        private Double frequencyPenalty;
        private Double presencePenalty;
        private List<String> stopSequences;
        private ReasoningProperties reasoning;

        public ModelParams toModelParams() {
            return ModelParams.builder()
                    .stream(stream)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .topP(topP)
                    .frequencyPenalty(frequencyPenalty)
                    .presencePenalty(presencePenalty)
                    .stopSequences(stopSequences == null || stopSequences.isEmpty() ? null : stopSequences)
                    .reasoning(reasoning == null ? null : reasoning.toReasoningParams())
                    .build();
        }
    }

    @Data
    public static class ReasoningProperties {
        private Boolean enabled;
        private Boolean exclude;
        private Integer maxTokens;
        private String effort;

        public ReasoningParams toReasoningParams() {
            return ReasoningParams.builder()
                    .enabled(enabled)
                    .exclude(exclude)
                    .maxTokens(maxTokens)
                    .effort(effort)
                    .build();
        }
    }
}
