package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One typed element of a multimodal message body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentPart {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE = "image_url";
    public static final String TYPE_FILE = "file";
    public static final String TYPE_AUDIO = "input_audio";

    private String type;
    private String text;
    @JsonProperty("image_url")
    private ImageUrl imageUrl;
    private FileData file;
    @JsonProperty("input_audio")
    private InputAudio inputAudio;
    private List<Annotation> annotations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageUrl {
        private String url;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileData {
        private String filename;
        @JsonProperty("file_data")
        private String fileData;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InputAudio {
        private String data;
        private String format;
    }

    public static ContentPart text(String text) {
        return ContentPart.builder().type(TYPE_TEXT).text(text).build();
    }

    public static ContentPart image(String url) {
        return ContentPart.builder().type(TYPE_IMAGE).imageUrl(new ImageUrl(url)).build();
    }

    public static ContentPart file(String filename, String fileData) {
        return ContentPart.builder().type(TYPE_FILE).file(new FileData(filename, fileData)).build();
    }

    public static ContentPart audio(String data, String format) {
        return ContentPart.builder().type(TYPE_AUDIO).inputAudio(new InputAudio(data, format)).build();
    }
}
