package com.zzf.gazer.config;

import com.zzf.gazer.provider.Provider;
import com.zzf.gazer.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.concurrent.Executor;

/**
 * Fetches every provider's catalog in the background at startup. Failures are logged only.
 */
@Slf4j
public class CatalogWarmUp implements ApplicationRunner {

    private final ProviderRegistry registry;
    private final Executor executor;
    private final boolean enabled;

    public CatalogWarmUp(ProviderRegistry registry, Executor executor, boolean enabled) {
        this.registry = registry;
        this.executor = executor;
        this.enabled = enabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("ai.catalog.warmup.disabled");
            return;
        }
        for (String name : registry.providers()) {
            executor.execute(() -> warmUp(name));
        }
    }

    void warmUp(String name) {
        try {
            Provider provider = registry.getProvider(name);
            int count = provider.getModels(false, true).size();
            log.info("ai.catalog.warmup provider={} models={}", name, count);
        } catch (RuntimeException e) {
            log.error("ai.catalog.warmup.failed provider={}", name, e);
        }
    }
}
