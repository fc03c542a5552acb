package com.zzf.gazer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Citation or attachment reference returned alongside generated text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Annotation {
    private String type;
    private String text;
    @JsonProperty("url_citation")
    private UrlCitation urlCitation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UrlCitation {
        private String url;
        private String title;
        private String content;
        @JsonProperty("start_index")
        private Integer startIndex;
        @JsonProperty("end_index")
        private Integer endIndex;
    }
}
