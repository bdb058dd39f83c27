package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformRating(
    @JsonProperty("rating") double rating,
    @JsonProperty("reviews") long reviews
) {}
