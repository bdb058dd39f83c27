package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SerpData(
    @JsonProperty("position") Integer position,
    @JsonProperty("url") String url,
    @JsonProperty("title") String title,
    @JsonProperty("snippet") String snippet,
    @JsonProperty("featuredSnippet") Boolean featuredSnippet,
    @JsonProperty("localPack") Boolean localPack,
    @JsonProperty("adsAbove") Integer adsAbove,
    @JsonProperty("adsBelow") Integer adsBelow
) {
    @JsonIgnore
    public boolean hasSignature() {
        return position != null || featuredSnippet != null;
    }
}
