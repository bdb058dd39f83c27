package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KeywordRanking(
    @JsonProperty("keyword") String keyword,
    @JsonProperty("position") int position,
    @JsonProperty("searchVolume") long searchVolume,
    @JsonProperty("difficulty") int difficulty
) {}
