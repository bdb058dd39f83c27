package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Review summary; {@code platforms} is keyed by review site (google, yelp, trustpilot, ...). */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewData(
    @JsonProperty("averageRating") Double averageRating,
    @JsonProperty("totalReviews") Long totalReviews,
    @JsonProperty("platforms") Map<String, PlatformRating> platforms,
    @JsonProperty("sentiment") Sentiment sentiment
) {
    @JsonIgnore
    public boolean hasSignature() {
        return averageRating != null || totalReviews != null;
    }
}
