package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Social reach keyed by platform name (facebook, instagram, twitter, linkedin, ...). */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SocialData(
    @JsonProperty("platforms") Map<String, PlatformAudience> platforms,
    @JsonProperty("mentions") Long mentions,
    @JsonProperty("sentiment") Sentiment sentiment
) {
    @JsonIgnore
    public boolean hasSignature() {
        return platforms != null || mentions != null;
    }
}
