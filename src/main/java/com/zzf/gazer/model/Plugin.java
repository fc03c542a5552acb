package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Server-side plugin switched on for a request (web search, file parsing).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Plugin {

    public static final String WEB = "web";
    public static final String FILE_PARSER = "file-parser";
    public static final String ENGINE_NATIVE = "native";
    public static final String ENGINE_PDF_TEXT = "pdf-text";

    String id;
    Pdf pdf;
    @JsonProperty("max_results")
    Integer maxResults;
    @JsonProperty("search_prompt")
    String searchPrompt;

    @Value
    public static class Pdf {
        String engine;
    }

    public static Plugin web(int maxResults) {
        return Plugin.builder().id(WEB).maxResults(maxResults).build();
    }

    public static Plugin fileParser(String engine) {
        return Plugin.builder().id(FILE_PARSER).pdf(new Pdf(engine)).build();
    }
}
