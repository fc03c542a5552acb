package com.zzf.gazer.tool;

import com.zzf.gazer.model.Tool;

import java.util.List;

/**
 * Built-in tool declarations. The tools themselves run outside this library.
 */
public final class ToolDeclarations {

    public static final String WEATHER = "weather";
    public static final String SEARCH = "search";
    public static final String FETCH_URL = "fetch_url";
    public static final String GENERATE_IMAGE = "generate_image";
    public static final String SEARCH_IMAGES = "search_images";

    private static final List<String> TIME_LIMITS = List.of("", "d", "w", "m", "y");

    private ToolDeclarations() {}

    public static Tool weather() {
        return Tool.function(WEATHER, "Fetches comprehensive weather forecasts", Tool.Parameters.builder()
                .property("location", Tool.Property.builder()
                        .type("string")
                        .description("City name in English (e.g., `London`, `New+York`)")
                        .build())
                .property("days", Tool.Property.builder()
                        .type("integer")
                        .description("Number of forecast days (1-3). 1 - Today, 2 - Today and tomorrow, etc.")
                        .build())
                .required(List.of("location", "days"))
                .build());
    }

    public static Tool search() {
        return Tool.function(SEARCH, "Search with duckduckgo, use when need more relevant information.", Tool.Parameters.builder()
                .property("query", Tool.Property.builder().type("string").description("Search query").build())
                .property("max_results", Tool.Property.builder()
                        .type("integer")
                        .description("Max search results. Min: 3, max: 10")
                        .build())
                .property("time_limit", timeLimit("Leave empty for all time."))
                .required(List.of("query", "max_results"))
                .build());
    }

    public static Tool fetchUrl() {
        return Tool.function(FETCH_URL,
                "Fetch full content from URL. Use when you need more info from URL (e.g. after search) or if user asks.",
                Tool.Parameters.builder()
                        .property("url", Tool.Property.builder().type("string").build())
                        .required(List.of("url"))
                        .build());
    }

    public static Tool searchImages() {
        return Tool.function(SEARCH_IMAGES, "Search images in internet", Tool.Parameters.builder()
                .property("keywords", Tool.Property.builder().type("string").description("Search keywords").build())
                .property("max_results", Tool.Property.builder()
                        .type("integer")
                        .description("Limit images in result. Min 1, max 5")
                        .build())
                .property("time_limit", timeLimit("Default: empty. Leave empty for all time."))
                .required(List.of("keywords", "max_results"))
                .build());
    }

    public static Tool generateImage() {
        return Tool.function(GENERATE_IMAGE, "Generate image with prompt", Tool.Parameters.builder()
                .property("prompt", Tool.Property.builder().type("string").description("Detailed prompt in English").build())
                .required(List.of("prompt"))
                .build());
    }

    private static Tool.Property timeLimit(String suffix) {
        return Tool.Property.builder()
                .type("string")
                .enumValues(TIME_LIMITS)
                .description("Time range for search results: 'd' (last 24h), 'w' (last week), 'm' (last month), "
                        + "'y' (last year). " + suffix)
                .build();
    }
}
