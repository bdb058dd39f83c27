package com.intelplatform.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intelplatform.common.exception.ProviderException;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.common.payload.PricingData;
import com.intelplatform.common.payload.ReviewData;
import com.intelplatform.common.payload.SeoData;
import com.intelplatform.common.payload.SerpData;
import com.intelplatform.common.payload.SocialData;
import com.intelplatform.common.payload.TrafficData;
import org.springframework.stereotype.Component;

/**
 * Maps a provider's flat JSON body onto the category sections. A section is kept only
 * when its signature fields are present, so one body may yield several categories.
 */
@Component
public class ProviderPayloadMapper {

    private final ObjectMapper objectMapper;

    public ProviderPayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IntelPayload map(String providerId, JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new ProviderException(providerId, "Unexpected response body");
        }
        JsonNode root = body.has("data") && body.get("data").isObject() ? body.get("data") : body;
        try {
            SeoData seo = objectMapper.treeToValue(root, SeoData.class);
            TrafficData traffic = objectMapper.treeToValue(root, TrafficData.class);
            PricingData pricing = objectMapper.treeToValue(root, PricingData.class);
            SerpData serp = objectMapper.treeToValue(root, SerpData.class);
            SocialData social = objectMapper.treeToValue(root, SocialData.class);
            ReviewData reviews = objectMapper.treeToValue(root, ReviewData.class);
            return new IntelPayload(
                seo.hasSignature() ? seo : null,
                traffic.hasSignature() ? traffic : null,
                pricing.hasSignature() ? pricing : null,
                serp.hasSignature() ? serp : null,
                social.hasSignature() ? social : null,
                reviews.hasSignature() ? reviews : null);
        } catch (JsonProcessingException e) {
            throw new ProviderException(providerId, "Malformed response: " + e.getOriginalMessage(), e);
        }
    }
}
