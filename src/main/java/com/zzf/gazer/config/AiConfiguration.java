package com.zzf.gazer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.gazer.chat.InMemoryChatSettings;
import com.zzf.gazer.registry.ProviderRegistry;
import com.zzf.gazer.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class AiConfiguration {

    @Bean
    public HttpClient aiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService aiStreamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ai-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock aiClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ToolRegistry toolRegistry(AiProperties properties) {
        boolean imageGeneration = properties.getImageRouterApiKey() != null && !properties.getImageRouterApiKey().isEmpty();
        ToolRegistry registry = ToolRegistry.defaults(imageGeneration);
        log.info("ai.tools.registered tools={}", registry.all().keySet());
        return registry;
    }

    @Bean
    public InMemoryChatSettings chatSettings(AiProperties properties) {
        return new InMemoryChatSettings(properties);
    }

    @Bean
    public ProviderRegistry providerRegistry(AiProperties properties, HttpClient aiHttpClient, ObjectMapper objectMapper,
                                             @Qualifier("aiStreamExecutor") ExecutorService aiStreamExecutor,
                                             Clock aiClock, InMemoryChatSettings chatSettings) {
        ProviderFactory factory = new ProviderFactory(aiHttpClient, objectMapper, aiStreamExecutor,
                properties.getRequestTimeout(), aiClock, System::getenv);
        ProviderRegistry registry = new ProviderRegistry(properties);
        for (AiProperties.ProviderProperties provider : properties.getProviders()) {
            factory.create(provider).ifPresent(registry::register);
        }
        registry.setChatSettings(chatSettings);
        log.info("ai.registry.ready providers={} defaultModel={}", registry.providers(), properties.getDefaultModel());
        return registry;
    }

    @Bean
    public CatalogWarmUp catalogWarmUp(AiProperties properties, ProviderRegistry providerRegistry,
                                       @Qualifier("aiStreamExecutor") ExecutorService aiStreamExecutor) {
        return new CatalogWarmUp(providerRegistry, aiStreamExecutor, properties.isWarmUpCatalogs());
    }
}
