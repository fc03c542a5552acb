package com.zzf.gazer.config;

import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AiPropertiesTest {

    private static AiProperties.ModelParamsProperties params(Double temperature, Integer maxTokens) {
        AiProperties.ModelParamsProperties params = new AiProperties.ModelParamsProperties();
        params.setTemperature(temperature);
        params.setMaxTokens(maxTokens);
        return params;
    }

    private static AiProperties layered() {
        AiProperties properties = new AiProperties();
        properties.setModelParams(params(0.7, 4096));

        AiProperties.ProviderProperties provider = new AiProperties.ProviderProperties();
        provider.setName("openrouter");
        provider.setModelParams(params(0.5, null));
        properties.getProviders().add(provider);

        AiProperties.AliasProperties alias = new AiProperties.AliasProperties();
        alias.setAlias("think");
        alias.setModel("openrouter:deepseek/deepseek-r1");
        alias.setModelParams(params(null, 8192));
        properties.getAliases().add(alias);

        AiProperties.PromptProperties prompt = new AiProperties.PromptProperties();
        prompt.setName("coder");
        prompt.setAliases(List.of("code"));
        prompt.setModelParams(params(0.2, null));
        properties.getPrompts().add(prompt);
        return properties;
    }

    @Test
    public void testLayersApplyInOrder() {
        AiProperties properties = layered();

        assertEquals(0.5, properties.fullModelParams("openrouter", null, null).getTemperature());
        assertEquals(8192, properties.fullModelParams("openrouter", "think", null).getMaxTokens());

        ModelParams all = properties.fullModelParams("openrouter", "think", "code");
        assertEquals(0.2, all.getTemperature());
        assertEquals(8192, all.getMaxTokens());
    }

    @Test
    public void testUnknownLayersAreSkipped() {
        ModelParams params = layered().fullModelParams("nowhere", "nothing", "none");

        assertEquals(0.7, params.getTemperature());
        assertEquals(4096, params.getMaxTokens());
    }

    @Test
    public void testInvalidLayerIsNamed() {
        AiProperties properties = layered();
        properties.getAliases().get(0).setModelParams(params(3.0, null));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> properties.fullModelParams("openrouter", "think", null));

        assertTrue(error.getMessage().startsWith("alias params: temperature"));
    }

    @Test
    public void testInvalidGlobalIsNamed() {
        AiProperties properties = layered();
        properties.setModelParams(params(null, 0));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> properties.fullModelParams(null, null, null));

        assertTrue(error.getMessage().startsWith("global params: max_tokens"));
    }

    @Test
    public void testPromptLookupByAlias() {
        AiProperties properties = layered();

        assertEquals("coder", properties.getPrompt("code").get().getName());
        assertEquals("coder", properties.getPrompt("coder").get().getName());
        assertTrue(properties.getPrompt("writer").isEmpty());
    }

    @Test
    public void testResolveApiKey() {
        AiProperties.ProviderProperties provider = new AiProperties.ProviderProperties();
        Map<String, String> env = Map.of("OPENROUTER_API_KEY", "from-env");

        assertEquals("", provider.resolveApiKey(env::get));

        provider.setEnvApiKey("OPENROUTER_API_KEY");
        assertEquals("from-env", provider.resolveApiKey(env::get));

        provider.setEnvApiKey("MISSING");
        assertEquals("", provider.resolveApiKey(env::get));

        provider.setApiKey("inline");
        assertEquals("inline", provider.resolveApiKey(env::get));
    }

    @Test
    public void testConfiguredModels() {
        AiProperties.ProviderProperties provider = new AiProperties.ProviderProperties();
        provider.setName("local");
        AiProperties.ModelProperties mini = new AiProperties.ModelProperties();
        mini.setModel("mini");
        mini.setFree(true);
        mini.setInputModalities(List.of("text", "image"));
        AiProperties.ModelProperties big = new AiProperties.ModelProperties();
        big.setModel("big");
        provider.setModels(List.of(mini, big));

        List<ModelInfo> models = provider.configuredModels();

        assertEquals("local", models.get(0).getProvider());
        assertTrue(models.get(0).isFree());
        assertEquals(List.of("text", "image"), models.get(0).getArchitecture().getInputModalities());
        assertNull(models.get(1).getPricing());
    }

    @Test
    public void testReasoningLayer() {
        AiProperties.ReasoningProperties reasoning = new AiProperties.ReasoningProperties();
        reasoning.setEffort("high");
        AiProperties.ModelParamsProperties params = new AiProperties.ModelParamsProperties();
        params.setReasoning(reasoning);
        params.setStopSequences(List.of());

        ModelParams converted = params.toModelParams();

        assertEquals("high", converted.getReasoning().getEffort());
        assertNull(converted.getStopSequences());
    }
}
