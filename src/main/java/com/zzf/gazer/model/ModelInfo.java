package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Catalog entry of a model on a provider. Identified by {@code (provider, id)}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelInfo {

    public static final String FREE_BADGE = "🆓";
    public static final String TOOLS_BADGE = "🛠️";
    public static final String TEXT_BADGE = "💬";
    public static final String IMAGE_RECOGNITION_BADGE = "👁️";
    public static final String IMAGE_GENERATION_BADGE = "🖼️";
    public static final String FILE_BADGE = "📄";
    public static final String AUDIO_BADGE = "🎵";

    @EqualsAndHashCode.Include
    String id;
    @EqualsAndHashCode.Include
    String provider;
    String alias;
    Architecture architecture;
    Pricing pricing;
    @JsonProperty("supported_parameters")
    List<String> supportedParameters;
    Long created;

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Architecture {
        String modality;
        @JsonProperty("input_modalities")
        List<String> inputModalities;
        @JsonProperty("output_modalities")
        List<String> outputModalities;
        String tokenizer;
    }

    /**
     * Per-unit prices as reported by the provider, kept as strings.
     */
    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pricing {
        public static final Pricing FREE = new Pricing("0", "0", "0", "0");

        String prompt;
        String completion;
        String image;
        @JsonProperty("web_search")
        String webSearch;

        @JsonIgnore
        public boolean isFree() {
            return "0".equals(prompt) && "0".equals(completion) && "0".equals(image) && "0".equals(webSearch);
        }
    }

    public static ModelInfo placeholder(String id, String provider) {
        return ModelInfo.builder().id(id).provider(provider).build();
    }

    public ModelInfo withAlias(String alias) {
        return toBuilder().alias(alias).build();
    }

    public ModelInfo withProvider(String provider) {
        return toBuilder().provider(provider).build();
    }

    public String fullName() {
        if (provider == null || provider.isEmpty()) {
            return id;
        }
        return provider + ":" + id;
    }

    @JsonIgnore
    public boolean isFree() {
        return pricing != null && pricing.isFree();
    }

    public boolean supportsTools() {
        return supportedParameters != null && supportedParameters.contains("tools");
    }

    public boolean supportsInputModality(String modality) {
        return architecture != null && architecture.getInputModalities() != null
                && architecture.getInputModalities().contains(modality);
    }

    public boolean supportsOutputModality(String modality) {
        return architecture != null && architecture.getOutputModalities() != null
                && architecture.getOutputModalities().contains(modality);
    }

    public boolean supportsImageRecognition() {
        return supportsInputModality("image");
    }

    public boolean supportsImageGeneration() {
        return supportsOutputModality("image");
    }

    public boolean supportsFiles() {
        return supportsInputModality("file");
    }

    public boolean supportsAudioRecognition() {
        return supportsInputModality("audio");
    }

    public boolean supportsText() {
        return supportsInputModality("text") && supportsOutputModality("text");
    }

    @JsonIgnore
    public boolean isMultimodal() {
        return supportsImageRecognition() || supportsFiles() || supportsAudioRecognition();
    }

    public Instant createdAt() {
        return created == null ? Instant.EPOCH : Instant.ofEpochSecond(created);
    }

    /**
     * Compact badge line, e.g. {@code 🆓💬👁️ \> 💬🛠️}.
     */
    public String formattedModalities() {
        String input = badges(architecture == null ? null : architecture.getInputModalities(), IMAGE_RECOGNITION_BADGE);
        String output = badges(architecture == null ? null : architecture.getOutputModalities(), IMAGE_GENERATION_BADGE);
        String modalities = "❓";
        if (!input.isEmpty() && !output.isEmpty()) {
            modalities = input + " \\> " + output;
        }
        return (isFree() ? FREE_BADGE : "") + modalities + (supportsTools() ? TOOLS_BADGE : "");
    }

    private static String badges(List<String> modalities, String imageBadge) {
        if (modalities == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String modality : modalities) {
            switch (modality) {
                case "text" -> sb.append(TEXT_BADGE);
                case "image" -> sb.append(imageBadge);
                case "file" -> sb.append(FILE_BADGE);
                case "audio" -> sb.append(AUDIO_BADGE);
                default -> {
                }
            }
        }
        return sb.toString();
    }
}
