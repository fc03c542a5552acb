package com.zzf.gazer.chat;

import com.zzf.gazer.config.AiProperties;
import com.zzf.gazer.model.ModelParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryChatSettingsTest {

    private InMemoryChatSettings settings;

    @BeforeEach
    public void setUp() {
        AiProperties properties = new AiProperties();
        AiProperties.ModelParamsProperties global = new AiProperties.ModelParamsProperties();
        global.setTemperature(0.7);
        global.setMaxTokens(4096);
        properties.setModelParams(global);
        settings = new InMemoryChatSettings(properties);
    }

    @Test
    public void testModelSpecLifecycle() {
        assertTrue(settings.currentModelSpec(1).isEmpty());

        settings.setModelSpec(1, "local:mini");
        assertEquals(Optional.of("local:mini"), settings.currentModelSpec(1));
        assertTrue(settings.currentModelSpec(2).isEmpty());

        settings.setModelSpec(1, "");
        assertTrue(settings.currentModelSpec(1).isEmpty());
    }

    @Test
    public void testStoredParamsSitBetweenConfigAndRequest() {
        settings.updateParams(1, ModelParams.builder().temperature(0.3).build());
        settings.updateParams(1, ModelParams.builder().topP(0.9).build());

        ModelParams merged = settings.mergeModelParams(1, null, null, null, ModelParams.builder().maxTokens(100).build());

        assertEquals(0.3, merged.getTemperature());
        assertEquals(0.9, merged.getTopP());
        assertEquals(100, merged.getMaxTokens());
    }

    @Test
    public void testOtherChatsUseConfigOnly() {
        settings.updateParams(1, ModelParams.builder().temperature(0.3).build());

        ModelParams merged = settings.mergeModelParams(2, null, null, null, null);

        assertEquals(0.7, merged.getTemperature());
        assertEquals(4096, merged.getMaxTokens());
    }

    @Test
    public void testInvalidParamsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> settings.updateParams(1, ModelParams.builder().temperature(5.0).build()));
        assertEquals(0.7, settings.mergeModelParams(1, null, null, null, null).getTemperature());
    }

    @Test
    public void testNullParamsKeepStoredValues() {
        settings.updateParams(1, ModelParams.builder().temperature(0.3).build());

        settings.updateParams(1, null);
        settings.updateParams(2, null);

        assertEquals(0.3, settings.mergeModelParams(1, null, null, null, null).getTemperature());
        assertEquals(0.7, settings.mergeModelParams(2, null, null, null, null).getTemperature());
    }

    @Test
    public void testClear() {
        settings.setModelSpec(1, "local:mini");
        settings.updateParams(1, ModelParams.builder().temperature(0.1).build());

        settings.clear(1);

        assertTrue(settings.currentModelSpec(1).isEmpty());
        assertEquals(0.7, settings.mergeModelParams(1, null, null, null, null).getTemperature());
    }
}
