package com.zzf.gazer.config;

import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.provider.Provider;
import com.zzf.gazer.registry.ProviderRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CatalogWarmUpTest {

    private static Provider provider(String name) {
        Provider provider = mock(Provider.class);
        when(provider.getName()).thenReturn(name);
        return provider;
    }

    @Test
    public void testFetchesEveryProviderAndSurvivesFailures() {
        Provider broken = provider("broken");
        Provider healthy = provider("healthy");
        when(broken.getModels(false, true)).thenThrow(new IllegalStateException("down"));
        when(healthy.getModels(false, true)).thenReturn(Map.of("m", ModelInfo.placeholder("m", "healthy")));
        ProviderRegistry registry = new ProviderRegistry(new AiProperties());
        registry.register(broken);
        registry.register(healthy);

        new CatalogWarmUp(registry, Runnable::run, true).run(null);

        verify(broken).getModels(false, true);
        verify(healthy).getModels(false, true);
    }

    @Test
    public void testDisabledDoesNothing() {
        Provider provider = provider("p");
        ProviderRegistry registry = new ProviderRegistry(new AiProperties());
        registry.register(provider);

        new CatalogWarmUp(registry, Runnable::run, false).run(null);

        verify(provider, never()).getModels(anyBoolean(), anyBoolean());
    }
}
