package com.zzf.gazer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.gazer.catalog.ModelCatalog;
import com.zzf.gazer.provider.ChatCompletionClient;
import com.zzf.gazer.provider.LocalProvider;
import com.zzf.gazer.provider.OpenAiCompatibleProvider;
import com.zzf.gazer.provider.OpenRouterProvider;
import com.zzf.gazer.provider.Provider;
import com.zzf.gazer.transport.ApiTransport;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Builds providers from their configuration entries.
 */
@Slf4j
public class ProviderFactory {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor streamExecutor;
    private final Duration requestTimeout;
    private final Clock clock;
    private final UnaryOperator<String> env;

    public ProviderFactory(HttpClient httpClient, ObjectMapper objectMapper, Executor streamExecutor,
                           Duration requestTimeout, Clock clock, UnaryOperator<String> env) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        this.env = env;
    }

    /**
     * Empty for an unknown type.
     */
    public Optional<Provider> create(AiProperties.ProviderProperties cfg) {
        String type = cfg.getType() == null ? "" : cfg.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case OpenRouterProvider.TYPE -> {
                String baseUrl = isBlank(cfg.getBaseUrl()) ? OpenRouterProvider.DEFAULT_BASE_URL : cfg.getBaseUrl();
                ChatCompletionClient client = client(cfg, baseUrl, cfg.resolveApiKey(env));
                logCreated(type, cfg, baseUrl);
                return Optional.of(new OpenRouterProvider(cfg.getName(), cfg.getDefaultModel(), client,
                        catalog(cfg, client, cfg.isOverrideModels())));
            }
            case OpenAiCompatibleProvider.TYPE -> {
                ChatCompletionClient client = client(cfg, cfg.getBaseUrl(), cfg.resolveApiKey(env));
                logCreated(type, cfg, cfg.getBaseUrl());
                return Optional.of(new OpenAiCompatibleProvider(cfg.getName(), cfg.getDefaultModel(), client,
                        catalog(cfg, client, cfg.isOverrideModels())));
            }
            case LocalProvider.TYPE -> {
                ChatCompletionClient client = client(cfg, cfg.getBaseUrl(), "");
                logCreated(type, cfg, cfg.getBaseUrl());
                return Optional.of(new LocalProvider(cfg.getName(), cfg.getDefaultModel(), client,
                        catalog(cfg, client, true)));
            }
            default -> {
                log.warn("ai.provider.unsupported name={} type={}", cfg.getName(), cfg.getType());
                return Optional.empty();
            }
        }
    }

    private ChatCompletionClient client(AiProperties.ProviderProperties cfg, String baseUrl, String apiKey) {
        ApiTransport transport = new ApiTransport(httpClient, objectMapper, baseUrl, apiKey, requestTimeout);
        return new ChatCompletionClient(cfg.getName(), transport, objectMapper, streamExecutor, cfg.getChatUrl());
    }

    private ModelCatalog catalog(AiProperties.ProviderProperties cfg, ChatCompletionClient client, boolean configOnly) {
        return ModelCatalog.builder(cfg.getName())
                .configured(cfg.configuredModels())
                .fetcher(client::fetchModels)
                .configOnly(configOnly)
                .onlyFreeModels(cfg.isOnlyFreeModels())
                .clock(clock)
                .build();
    }

    private static void logCreated(String type, AiProperties.ProviderProperties cfg, String baseUrl) {
        log.info("ai.provider.created name={} type={} url={} defaultModel={} configuredModels={} onlyFree={}",
                cfg.getName(), type, baseUrl, cfg.getDefaultModel(), cfg.getModels().size(), cfg.isOnlyFreeModels());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
