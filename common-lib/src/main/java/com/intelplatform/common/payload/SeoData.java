package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeoData(
    @JsonProperty("domainAuthority") Integer domainAuthority,
    @JsonProperty("backlinks") Long backlinks,
    @JsonProperty("referringDomains") Long referringDomains,
    @JsonProperty("organicKeywords") Long organicKeywords,
    @JsonProperty("topKeywords") List<KeywordRanking> topKeywords
) {
    /** SEO signature: domain authority, backlinks or organic keyword count. */
    @JsonIgnore
    public boolean hasSignature() {
        return domainAuthority != null || backlinks != null || organicKeywords != null;
    }
}
