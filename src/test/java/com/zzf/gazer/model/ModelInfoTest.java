package com.zzf.gazer.model;

import com.zzf.gazer.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelInfoTest {

    private static ModelInfo.Pricing pricing(String prompt, String completion, String image, String webSearch) {
        return ModelInfo.Pricing.builder().prompt(prompt).completion(completion).image(image).webSearch(webSearch).build();
    }

    @Test
    public void testFreeOnlyWhenAllFourComponentsAreZero() {
        ModelInfo free = ModelInfo.builder().id("m").pricing(pricing("0", "0", "0", "0")).build();
        assertTrue(free.isFree());

        assertFalse(ModelInfo.builder().id("m").pricing(pricing("0.0001", "0", "0", "0")).build().isFree());
        assertFalse(ModelInfo.builder().id("m").pricing(pricing("0", "0.2", "0", "0")).build().isFree());
        assertFalse(ModelInfo.builder().id("m").pricing(pricing("0", "0", "1", "0")).build().isFree());
        assertFalse(ModelInfo.builder().id("m").pricing(pricing("0", "0", "0", "0.5")).build().isFree());
        assertFalse(ModelInfo.builder().id("m").build().isFree());
    }

    @Test
    public void testDecodesCatalogEntry() throws Exception {
        String json = "{\"id\":\"google/gemma\",\"created\":1700000000,"
                + "\"architecture\":{\"input_modalities\":[\"text\",\"image\",\"file\"],\"output_modalities\":[\"text\"]},"
                + "\"pricing\":{\"prompt\":\"0\",\"completion\":\"0\",\"image\":\"0\",\"web_search\":\"0\",\"request\":\"0\"},"
                + "\"supported_parameters\":[\"tools\",\"temperature\"],\"context_length\":8192}";

        ModelInfo model = JsonUtils.MAPPER.readValue(json, ModelInfo.class);

        assertEquals("google/gemma", model.getId());
        assertTrue(model.isFree());
        assertTrue(model.supportsTools());
        assertTrue(model.supportsImageRecognition());
        assertTrue(model.supportsFiles());
        assertFalse(model.supportsAudioRecognition());
        assertTrue(model.supportsText());
        assertTrue(model.isMultimodal());
        assertEquals(Instant.ofEpochSecond(1700000000L), model.createdAt());
    }

    @Test
    public void testIdentityIsProviderAndId() {
        ModelInfo a = ModelInfo.builder().id("x").provider("p").alias("fast").build();
        ModelInfo b = ModelInfo.placeholder("x", "p");

        assertEquals(a, b);
        assertNotEquals(a, ModelInfo.placeholder("x", "q"));
        assertEquals("p:x", a.fullName());
        assertEquals("q:x", a.withProvider("q").fullName());
        assertEquals("fast", b.withAlias("fast").getAlias());
    }

    @Test
    public void testFormattedModalities() {
        ModelInfo model = ModelInfo.builder()
                .id("m")
                .pricing(ModelInfo.Pricing.FREE)
                .supportedParameters(List.of("tools"))
                .architecture(ModelInfo.Architecture.builder()
                        .inputModalities(List.of("text", "image"))
                        .outputModalities(List.of("text"))
                        .build())
                .build();

        assertEquals(ModelInfo.FREE_BADGE + ModelInfo.TEXT_BADGE + ModelInfo.IMAGE_RECOGNITION_BADGE
                + " \\> " + ModelInfo.TEXT_BADGE + ModelInfo.TOOLS_BADGE, model.formattedModalities());
        assertEquals("❓", ModelInfo.placeholder("m", "p").formattedModalities());
    }
}
