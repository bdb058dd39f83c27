package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Category-tagged intelligence payload.
 *
 * <p>Used both for what one provider returns and for the merged result. Each section is
 * {@code null} when the category is absent, so category membership is a presence check
 * plus the section's own signature test rather than probing an untyped map.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntelPayload(
    @JsonProperty("seo") SeoData seo,
    @JsonProperty("traffic") TrafficData traffic,
    @JsonProperty("pricing") PricingData pricing,
    @JsonProperty("serp") SerpData serp,
    @JsonProperty("social") SocialData social,
    @JsonProperty("reviews") ReviewData reviews
) {
    public static IntelPayload empty() {
        return new IntelPayload(null, null, null, null, null, null);
    }

    public static IntelPayload ofSeo(SeoData seo) {
        return new IntelPayload(seo, null, null, null, null, null);
    }

    public static IntelPayload ofTraffic(TrafficData traffic) {
        return new IntelPayload(null, traffic, null, null, null, null);
    }

    public static IntelPayload ofPricing(PricingData pricing) {
        return new IntelPayload(null, null, pricing, null, null, null);
    }

    public static IntelPayload ofSerp(SerpData serp) {
        return new IntelPayload(null, null, null, serp, null, null);
    }

    public static IntelPayload ofSocial(SocialData social) {
        return new IntelPayload(null, null, null, null, social, null);
    }

    public static IntelPayload ofReviews(ReviewData reviews) {
        return new IntelPayload(null, null, null, null, null, reviews);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return seo == null && traffic == null && pricing == null
            && serp == null && social == null && reviews == null;
    }
}
